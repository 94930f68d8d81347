package com.federation.domain.model;

public enum TransportKind {
    REAL_TIME,
    MESSAGE_BUS,
    FULL_MIRROR
}
