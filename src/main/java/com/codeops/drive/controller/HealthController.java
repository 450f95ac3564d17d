package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness endpoint.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check")
public class HealthController {

    private final Clock clock;

    @GetMapping
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", AppConstants.SERVICE_NAME);
        body.put("timestamp", Instant.now(clock).toString());
        return body;
    }
}
