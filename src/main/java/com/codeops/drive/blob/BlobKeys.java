package com.codeops.drive.blob;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Generates and validates blob keys. Keys have the form {@code files/<uuid>}.
 */
public final class BlobKeys {

    private static final String PREFIX = "files/";

    private static final Pattern KEY_PATTERN = Pattern.compile(
            "files/[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private BlobKeys() {}

    public static String newKey() {
        return PREFIX + UUID.randomUUID();
    }

    public static boolean isValid(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }
}
