package com.codeops.drive.security;

import com.codeops.drive.support.MutableClock;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

/**
 * Tests for RateLimitFilter covering rate limiting behavior.
 */
@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    private RateLimitFilter rateLimitFilter;
    private MutableClock clock;

    @Mock
    private FilterChain filterChain;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
        rateLimitFilter = new RateLimitFilter(clock, false);
    }

    @Test
    void underLimit_passesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/test");
        request.setRequestURI("/api/v1/drive/test");
        MockHttpServletResponse response = new MockHttpServletResponse();

        rateLimitFilter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertThat(response.getStatus()).isNotEqualTo(429);
    }

    @Test
    void overLimit_returns429() throws Exception {
        for (int i = 0; i < 101; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/test");
            request.setRequestURI("/api/v1/drive/test");
            request.setRemoteAddr("192.168.1.1");
            MockHttpServletResponse response = new MockHttpServletResponse();
            rateLimitFilter.doFilterInternal(request, response, filterChain);

            if (i >= 100) {
                assertThat(response.getStatus()).isEqualTo(429);
                assertThat(response.getContentAsString()).contains("Too many requests");
            }
        }
    }

    @Test
    void differentIps_trackedSeparately() throws Exception {
        // Exhaust limit for IP 1
        for (int i = 0; i < 101; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/test");
            request.setRequestURI("/api/v1/drive/test");
            request.setRemoteAddr("10.0.0.1");
            MockHttpServletResponse response = new MockHttpServletResponse();
            rateLimitFilter.doFilterInternal(request, response, filterChain);
        }

        // IP 2 should still work
        MockHttpServletRequest request2 = new MockHttpServletRequest("GET", "/api/v1/drive/test");
        request2.setRequestURI("/api/v1/drive/test");
        request2.setRemoteAddr("10.0.0.2");
        MockHttpServletResponse response2 = new MockHttpServletResponse();
        rateLimitFilter.doFilterInternal(request2, response2, filterChain);

        assertThat(response2.getStatus()).isNotEqualTo(429);
    }

    @Test
    void forwardedHeader_usedAsClientKeyWhenTrusted() throws Exception {
        rateLimitFilter = new RateLimitFilter(clock, true);
        for (int i = 0; i < 101; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
            request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
            rateLimitFilter.doFilterInternal(request, new MockHttpServletResponse(), filterChain);
        }

        MockHttpServletRequest sameClient = new MockHttpServletRequest("GET", "/api/v1/drive/files");
        sameClient.addHeader("X-Forwarded-For", "203.0.113.7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        rateLimitFilter.doFilterInternal(sameClient, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(429);
    }

    @Test
    void nonApiPath_notLimited() throws Exception {
        for (int i = 0; i < 150; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v3/api-docs");
            request.setRemoteAddr("172.16.0.9");
            MockHttpServletResponse response = new MockHttpServletResponse();
            rateLimitFilter.doFilterInternal(request, response, filterChain);
            assertThat(response.getStatus()).isNotEqualTo(429);
        }
    }

    @Test
    void forwardedHeader_ignoredByDefault() throws Exception {
        for (int i = 0; i < 100; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
            request.setRemoteAddr("198.51.100.4");
            request.addHeader("X-Forwarded-For", "10.1.0." + i);
            rateLimitFilter.doFilterInternal(request, new MockHttpServletResponse(), filterChain);
        }

        MockHttpServletRequest spoofed = new MockHttpServletRequest("GET", "/api/v1/drive/files");
        spoofed.setRemoteAddr("198.51.100.4");
        spoofed.addHeader("X-Forwarded-For", "10.2.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        rateLimitFilter.doFilterInternal(spoofed, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(rateLimitFilter.trackedClients()).isEqualTo(1);
    }

    @Test
    void windowResets_afterWindowLength() throws Exception {
        for (int i = 0; i < 101; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
            request.setRemoteAddr("192.0.2.10");
            rateLimitFilter.doFilterInternal(request, new MockHttpServletResponse(), filterChain);
        }

        clock.advance(Duration.ofSeconds(60));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
        request.setRemoteAddr("192.0.2.10");
        MockHttpServletResponse response = new MockHttpServletResponse();
        rateLimitFilter.doFilterInternal(request, response, filterChain);

        assertThat(response.getStatus()).isNotEqualTo(429);
    }

    @Test
    void expiredWindows_sweptFromMemory() throws Exception {
        for (int i = 0; i < 50; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
            request.setRemoteAddr("203.0.113." + i);
            rateLimitFilter.doFilterInternal(request, new MockHttpServletResponse(), filterChain);
        }
        assertThat(rateLimitFilter.trackedClients()).isEqualTo(50);

        clock.advance(Duration.ofSeconds(61));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/drive/files");
        request.setRemoteAddr("192.0.2.99");
        rateLimitFilter.doFilterInternal(request, new MockHttpServletResponse(), filterChain);

        assertThat(rateLimitFilter.trackedClients()).isEqualTo(1);
    }
}
