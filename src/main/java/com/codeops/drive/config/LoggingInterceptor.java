package com.codeops.drive.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs the start and completion of every API request with its status and duration.
 * The correlation ID is already in the MDC, so it appears on both lines.
 */
@Component
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    public static final String START_TIME_ATTR = "drive.requestStartTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
        log.debug("-> {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTR);
        long duration = start instanceof Long startMillis ? System.currentTimeMillis() - startMillis : -1;
        if (response.getStatus() >= 500) {
            log.warn("<- {} {} {} ({} ms)", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);
        } else {
            log.info("<- {} {} {} ({} ms)", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);
        }
    }
}
