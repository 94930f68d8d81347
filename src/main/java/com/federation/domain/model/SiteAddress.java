package com.federation.domain.model;

import com.federation.domain.error.ValidationError.SiteAddressError;

import java.util.regex.Pattern;

/**
 * Value Object for a federation participant's stable address.
 * The same token names the site's update topic, so it is restricted to topic-safe characters.
 */
public record SiteAddress(String value) {

    public static final int MAX_LENGTH = 200;

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]+");

    public SiteAddress {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("SiteAddress value cannot be blank - use parse() for validation");
        }
    }

    /**
     * Parses a string into a SiteAddress, returning a Result for expected validation failures.
     */
    public static Result<SiteAddress, SiteAddressError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(SiteAddressError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH || !VALID.matcher(trimmed).matches()) {
            return Result.failure(new SiteAddressError.InvalidFormat(value));
        }
        return Result.success(new SiteAddress(trimmed));
    }

    /**
     * Creates a SiteAddress from a trusted source (database rows, our own configuration).
     *
     * @throws IllegalStateException if the value is not a valid address (indicates data corruption)
     */
    public static SiteAddress fromTrusted(String value) {
        var result = parse(value);
        if (result.isFailure()) {
            throw new IllegalStateException("Corrupted SiteAddress in trusted source: " + value);
        }
        return result.getOrThrow();
    }

    /**
     * True when the given raw address (possibly null) names this site.
     */
    public boolean matches(String raw) {
        return raw != null && value.equals(raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
