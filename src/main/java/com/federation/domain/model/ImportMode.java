package com.federation.domain.model;

/**
 * Where the reconciliation engine lands accepted items.
 */
public enum ImportMode {
    /** Full copies in the local content store. */
    CONTENT,
    /** Pointer entries in the federation index. */
    INDEX
}
