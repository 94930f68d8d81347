package com.federation.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 * Implementations should ensure time-ordering (e.g., UUIDv7) so edge ids sort by creation.
 */
public interface IdGenerator {

    UUID generate();
}
