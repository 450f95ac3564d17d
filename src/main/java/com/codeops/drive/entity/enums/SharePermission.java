package com.codeops.drive.entity.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Access level granted by a share. Ordered from least to most privileged.
 * Serialized as {@code "view"} / {@code "edit"}; parsing ignores case.
 */
public enum SharePermission {
    VIEW,
    EDIT;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SharePermission fromJson(String value) {
        if (value == null) {
            return null;
        }
        for (SharePermission permission : values()) {
            if (permission.name().equalsIgnoreCase(value.trim())) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown share permission: " + value);
    }
}
