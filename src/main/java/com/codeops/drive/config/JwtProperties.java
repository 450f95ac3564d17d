package com.codeops.drive.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for JWT token validation, bound to the
 * {@code codeops.jwt} prefix in application properties.
 *
 * <p>The Drive service only validates tokens. The {@code secret} must match the
 * signing secret used by the identity service that issues them.</p>
 *
 * @see com.codeops.drive.security.JwtTokenValidator
 */
@ConfigurationProperties(prefix = "codeops.jwt")
@Getter
@Setter
public class JwtProperties {
    private String secret;
}
