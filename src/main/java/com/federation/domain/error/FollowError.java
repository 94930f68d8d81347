package com.federation.domain.error;

import com.federation.domain.model.SiteAddress;

/**
 * Sealed type representing expected business errors for follow-edge operations at the application layer.
 * These errors are determined by querying state (repository), not by domain validation.
 *
 * For domain validation errors (like self-follow), see ValidationError.FollowValidationError.
 */
public sealed interface FollowError {

    record AlreadyFollowing(SiteAddress targetAddress) implements FollowError {
        @Override
        public String message() {
            return "Site " + targetAddress + " is already followed";
        }

        @Override
        public String code() {
            return "ALREADY_FOLLOWING";
        }
    }

    record NotFollowing(String edgeId) implements FollowError {
        @Override
        public String message() {
            return "No follow edge with id " + edgeId;
        }

        @Override
        public String code() {
            return "NOT_FOLLOWING";
        }
    }

    /**
     * Wraps a domain validation error that occurred during edge creation.
     */
    record ValidationFailed(ValidationError error) implements FollowError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
