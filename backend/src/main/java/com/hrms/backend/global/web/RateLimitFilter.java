package com.hrms.backend.global.web;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

import com.hrms.backend.global.error.ProblemResponseWriter;
import com.hrms.backend.modules.auth.application.AuthProblems;
import com.hrms.backend.modules.auth.application.RateLimitDecision;
import com.hrms.backend.modules.auth.application.RateLimiterService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * First gate of every request: the global per-IP window, then the per-endpoint window when one
 * is configured for the path.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimiterService rateLimiterService;
    private final ClientIpResolver clientIpResolver;
    private final ProblemResponseWriter problemResponseWriter;
    private final Clock clock;

    public RateLimitFilter(
            RateLimiterService rateLimiterService,
            ClientIpResolver clientIpResolver,
            ProblemResponseWriter problemResponseWriter,
            Clock clock
    ) {
        this.rateLimiterService = rateLimiterService;
        this.clientIpResolver = clientIpResolver;
        this.problemResponseWriter = problemResponseWriter;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String ip = clientIpResolver.resolve(request);
        RateLimitDecision decision;
        try {
            decision = rateLimiterService.checkIp(ip);
            if (decision.allowed()) {
                Optional<RateLimitDecision> endpoint = rateLimiterService.checkEndpoint(ip, request.getServletPath());
                if (endpoint.isPresent()) {
                    decision = endpoint.get();
                }
            }
        } catch (DataAccessException ex) {
            log.error("Rate limiter unavailable on {}", request.getRequestURI(), ex);
            problemResponseWriter.write(request, response, AuthProblems.backendUnavailable(ex));
            return;
        }

        response.setHeader(LIMIT_HEADER, Integer.toString(decision.limit()));
        response.setHeader(REMAINING_HEADER, Integer.toString(decision.remaining()));
        response.setHeader(RESET_HEADER, Long.toString(decision.resetAt().getEpochSecond()));

        if (!decision.allowed()) {
            log.warn("Rate limited {} on {}", ip, request.getServletPath());
            problemResponseWriter.write(request, response, AuthProblems.rateLimited(decision.retryAfter(clock.instant())));
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        return "OPTIONS".equalsIgnoreCase(request.getMethod()) || path.startsWith("/actuator/health");
    }
}
