package com.federation.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // SiteAddress validation errors
    sealed interface SiteAddressError extends ValidationError {

        record Empty() implements SiteAddressError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Site address cannot be empty";
            }

            @Override
            public String code() {
                return "SITE_ADDRESS_EMPTY";
            }
        }

        record InvalidFormat(String value) implements SiteAddressError {
            @Override
            public String message() {
                return "Site address must be at most 200 letters, digits, '.', '_' or '-': " + value;
            }

            @Override
            public String code() {
                return "SITE_ADDRESS_INVALID_FORMAT";
            }
        }
    }

    // Content validation errors
    sealed interface ContentError extends ValidationError {

        record MissingField(String field) implements ContentError {
            @Override
            public String message() {
                return "Content field '" + field + "' is required";
            }

            @Override
            public String code() {
                return "CONTENT_FIELD_MISSING";
            }
        }
    }

    // Follow validation errors
    sealed interface FollowValidationError extends ValidationError {

        record SelfFollow() implements FollowValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();
            @Override
            public String message() {
                return "A site cannot follow itself";
            }

            @Override
            public String code() {
                return "SELF_FOLLOW";
            }
        }
    }
}
