package com.federation.infrastructure.exception;

public class EdgeNotFoundException extends BusinessException {

    public EdgeNotFoundException(String edgeId) {
        super("EDGE_NOT_FOUND", "Follow edge not found: " + edgeId);
    }
}
