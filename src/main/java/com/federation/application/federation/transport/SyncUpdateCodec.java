package com.federation.application.federation.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON form of {@link SyncUpdateMessage}. Decoding never throws; a malformed message is reported as empty.
 */
public class SyncUpdateCodec {

    private static final Logger log = LoggerFactory.getLogger(SyncUpdateCodec.class);

    private final ObjectMapper objectMapper;

    public SyncUpdateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(SyncUpdateMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize update from " + message.siteId(), e);
        }
    }

    public Optional<SyncUpdateMessage> decode(String payload) {
        if (payload == null || payload.isBlank()) {
            log.warn("Dropping empty update message");
            return Optional.empty();
        }
        try {
            SyncUpdateMessage message = objectMapper.readValue(payload, SyncUpdateMessage.class);
            if (message.siteId() == null || message.siteId().isBlank()) {
                log.warn("Dropping update message without siteId");
                return Optional.empty();
            }
            return Optional.of(message);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed update message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
