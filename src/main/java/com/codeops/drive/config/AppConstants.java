package com.codeops.drive.config;

/**
 * Application-wide constants for the CodeOps-Drive service.
 * Centralizes rate limiting parameters, storage limits, and service metadata.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Base path prefix for all Drive API endpoints. */
    public static final String API_PREFIX = "/api/v1/drive";

    /** Maximum number of API requests allowed per rate-limiting window. */
    public static final int RATE_LIMIT_REQUESTS = 100;

    /** Duration of the rate-limiting window in seconds. */
    public static final int RATE_LIMIT_WINDOW_SECONDS = 60;

    /** Service name used in health checks and structured logging. */
    public static final String SERVICE_NAME = "codeops-drive";

    /** Default maximum upload size in bytes (10 MB). */
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    /** Default lifetime of a signed download URL in seconds (1 hour). */
    public static final long DEFAULT_SIGNED_URL_TTL_SECONDS = 3600;

    /** Maximum length of a folder or file name. */
    public static final int MAX_NAME_LENGTH = 255;

    /** Number of random bytes behind a public link token (hex-encoded to 64 characters). */
    public static final int PUBLIC_TOKEN_BYTES = 32;

    /** Upper bound on a public link lifetime in hours (one year). */
    public static final int MAX_PUBLIC_LINK_TTL_HOURS = 24 * 365;

    /** Mime type recorded when an upload does not declare one. */
    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /** Owner name shown on public link pages when the owner is no longer in the directory. */
    public static final String UNKNOWN_OWNER = "Unknown";
}
