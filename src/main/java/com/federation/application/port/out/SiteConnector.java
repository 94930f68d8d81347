package com.federation.application.port.out;

import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.exception.SiteUnavailableException;

import java.time.Duration;

/**
 * Opens another site's content collection. Dialing and peer discovery live behind this port.
 */
public interface SiteConnector {

    RemoteSite open(SiteAddress address, OpenMode mode, Duration timeout) throws SiteUnavailableException;

    enum OpenMode {
        /** Lightweight handle: change events and head-state queries. */
        OBSERVE,
        /** Full replication of the remote collection. */
        REPLICATE
    }

    interface RemoteSite extends AutoCloseable {
        SiteAddress address();

        String name();

        ContentStore content();

        @Override
        void close();
    }
}
