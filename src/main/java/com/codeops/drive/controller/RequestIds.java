package com.codeops.drive.controller;

import com.codeops.drive.exception.ValidationException;

import java.util.UUID;

/**
 * Parsing for optional ID query parameters, where an absent value, an empty value and
 * the literal {@code "null"} all select the root level.
 */
final class RequestIds {

    private RequestIds() {}

    static UUID optional(String raw, String parameterName) {
        if (raw == null || raw.isBlank() || "null".equalsIgnoreCase(raw.trim())) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid value for parameter: " + parameterName);
        }
    }
}
