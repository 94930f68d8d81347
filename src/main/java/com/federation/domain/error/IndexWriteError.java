package com.federation.domain.error;

/**
 * Expected refusals of a federation index write. A denial is a per-item outcome,
 * never a session failure.
 */
public sealed interface IndexWriteError {

    record Denied(String actorKey) implements IndexWriteError {
        @Override
        public String message() {
            return "Identity " + actorKey + " may not write to this federation index";
        }

        @Override
        public String code() {
            return "INDEX_WRITE_DENIED";
        }
    }

    record Invalid(String reason) implements IndexWriteError {
        @Override
        public String message() {
            return "Invalid index entry: " + reason;
        }

        @Override
        public String code() {
            return "INDEX_ENTRY_INVALID";
        }
    }

    record NotFound(String entryId) implements IndexWriteError {
        @Override
        public String message() {
            return "No index entry with id " + entryId;
        }

        @Override
        public String code() {
            return "INDEX_ENTRY_NOT_FOUND";
        }
    }

    String message();

    String code();
}
