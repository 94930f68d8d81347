package com.federation.support;

import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.SiteConnector;
import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.exception.SiteUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sites living in the same test process, keyed by address. Opening an unknown or unreachable address fails
 * the way a dial timeout would.
 */
public class InProcessSiteDirectory implements SiteConnector {

    private static final Logger log = LoggerFactory.getLogger(InProcessSiteDirectory.class);

    private final Map<SiteAddress, RegisteredSite> sites = new ConcurrentHashMap<>();
    private final Set<SiteAddress> unreachable = ConcurrentHashMap.newKeySet();

    private record RegisteredSite(SiteAddress address, String name, ContentStore content) {}

    public void register(SiteAddress address, String name, ContentStore content) {
        sites.put(address, new RegisteredSite(address, name, content));
        log.info("Site {} ({}) registered in directory", address, name);
    }

    /**
     * Simulates a partition: opens fail until the site is marked reachable again.
     */
    public void setReachable(SiteAddress address, boolean reachable) {
        if (reachable) {
            unreachable.remove(address);
        } else {
            unreachable.add(address);
        }
    }

    @Override
    public RemoteSite open(SiteAddress address, OpenMode mode, Duration timeout) throws SiteUnavailableException {
        RegisteredSite site = sites.get(address);
        if (site == null) {
            throw new SiteUnavailableException(address, "not found in directory within " + timeout.toMillis() + " ms");
        }
        if (unreachable.contains(address)) {
            throw new SiteUnavailableException(address, "unreachable");
        }
        log.debug("Opened {} in {} mode", address, mode);
        return new RemoteSite() {
            @Override
            public SiteAddress address() {
                return site.address();
            }

            @Override
            public String name() {
                return site.name();
            }

            @Override
            public ContentStore content() {
                return site.content();
            }

            @Override
            public void close() {
                log.debug("Closed handle to {}", address);
            }
        };
    }
}
