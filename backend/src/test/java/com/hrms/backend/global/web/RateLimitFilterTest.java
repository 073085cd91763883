package com.hrms.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.global.error.ProblemResponseWriter;
import com.hrms.backend.modules.auth.application.RateLimiterService;
import com.hrms.backend.support.InMemorySecurityCache;
import com.hrms.backend.support.MutableClock;
import com.hrms.backend.support.SecurityTestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

    private MutableClock clock;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T09:00:00Z");
        SecurityProperties properties = SecurityTestProperties.defaults();
        properties.getRateLimit().setIp(new SecurityProperties.Window(100, Duration.ofMinutes(1)));
        properties.getRateLimit().getEndpoints().put("/auth/login", new SecurityProperties.Window(2, Duration.ofMinutes(1)));
        RateLimiterService limiter = new RateLimiterService(new InMemorySecurityCache(clock), properties, clock);
        filter = new RateLimitFilter(limiter, new ClientIpResolver(properties),
                new ProblemResponseWriter(new ObjectMapper()), clock);
    }

    @Test
    void allowedRequestCarriesRateLimitHeaders() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/profile/me"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader(RateLimitFilter.LIMIT_HEADER)).isEqualTo("100");
        assertThat(response.getHeader(RateLimitFilter.REMAINING_HEADER)).isEqualTo("99");
        assertThat(response.getHeader(RateLimitFilter.RESET_HEADER))
                .isEqualTo(Long.toString(clock.instant().plusSeconds(60).getEpochSecond()));
    }

    @Test
    void endpointWindowRejectsWithRetryAfter() throws Exception {
        filter.doFilter(request("/auth/login"), new MockHttpServletResponse(), new MockFilterChain());
        clock.advance(Duration.ofSeconds(20));
        filter.doFilter(request("/auth/login"), new MockHttpServletResponse(), new MockFilterChain());

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request("/auth/login"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("40");
        assertThat(response.getHeader(RateLimitFilter.REMAINING_HEADER)).isEqualTo("0");
        assertThat(response.getContentAsString()).contains("\"code\":\"RATE_LIMITED\"");
    }

    @Test
    void healthCheckIsNotCounted() throws Exception {
        MockHttpServletRequest healthCheck = request("/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(healthCheck, response, new MockFilterChain());

        assertThat(response.getHeader(RateLimitFilter.LIMIT_HEADER)).isNull();
    }

    private static MockHttpServletRequest request(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setServletPath(path);
        request.setRemoteAddr("203.0.113.7");
        return request;
    }
}
