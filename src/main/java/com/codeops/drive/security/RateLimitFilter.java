package com.codeops.drive.security;

import com.codeops.drive.config.AppConstants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window rate limiter keyed by client IP. Applies to API paths only; each IP may
 * send {@link AppConstants#RATE_LIMIT_REQUESTS} requests per
 * {@link AppConstants#RATE_LIMIT_WINDOW_SECONDS}-second window before receiving 429.
 *
 * <p>The client IP is the socket address unless {@code codeops.rate-limit.trust-forwarded-for}
 * is set, which is only safe behind a proxy that overwrites {@code X-Forwarded-For}.
 * Windows that have ended are swept at most once per window length.</p>
 */
@Component
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private static final long WINDOW_MILLIS = AppConstants.RATE_LIMIT_WINDOW_SECONDS * 1000L;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMillis = new AtomicLong();
    private final Clock clock;
    private final boolean trustForwardedFor;

    public RateLimitFilter(Clock clock,
                           @Value("${codeops.rate-limit.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.clock = clock;
        this.trustForwardedFor = trustForwardedFor;
        this.lastSweepMillis.set(clock.millis());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!request.getRequestURI().startsWith(AppConstants.API_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        long now = clock.millis();
        sweepExpired(now);

        String clientIp = resolveClientIp(request);
        Window window = windows.compute(clientIp, (ip, current) ->
                current == null || current.hasEnded(now)
                        ? new Window(now, 1)
                        : new Window(current.startMillis(), current.count() + 1));

        if (window.count() > AppConstants.RATE_LIMIT_REQUESTS) {
            log.warn("Rate limit exceeded for {}", clientIp);
            response.setStatus(429);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"success\":false,\"status\":429,\"message\":\"Too many requests\"}");
            return;
        }
        filterChain.doFilter(request, response);
    }

    int trackedClients() {
        return windows.size();
    }

    private void sweepExpired(long now) {
        long last = lastSweepMillis.get();
        if (now - last < WINDOW_MILLIS || !lastSweepMillis.compareAndSet(last, now)) {
            return;
        }
        int before = windows.size();
        windows.values().removeIf(window -> window.hasEnded(now));
        log.debug("Rate limiter swept {} expired client windows", before - windows.size());
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }

    private record Window(long startMillis, int count) {

        boolean hasEnded(long now) {
            return now - startMillis >= WINDOW_MILLIS;
        }
    }
}
