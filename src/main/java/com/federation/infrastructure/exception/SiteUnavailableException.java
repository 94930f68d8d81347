package com.federation.infrastructure.exception;

import com.federation.domain.model.SiteAddress;

/**
 * The remote site could not be opened within the allotted time.
 */
public class SiteUnavailableException extends TransportException {

    private final SiteAddress address;

    public SiteUnavailableException(SiteAddress address, String message) {
        super("Site " + address + " unavailable: " + message);
        this.address = address;
    }

    public SiteAddress getAddress() {
        return address;
    }
}
