package com.hrms.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.hrms.backend.global.error.ProblemException;
import com.hrms.backend.global.error.ProblemResponseWriter;
import com.hrms.backend.modules.auth.application.AuthProblems;
import com.hrms.backend.modules.auth.application.JwtTokenService;
import com.hrms.backend.modules.auth.application.SessionRegistry;
import com.hrms.backend.modules.auth.application.TokenClaims;
import com.hrms.backend.modules.auth.domain.TokenType;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens: signature and claims first, then the revocation list.
 * Requests without a bearer token pass through unauthenticated.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final SessionRegistry sessionRegistry;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            SessionRegistry sessionRegistry,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.jwtTokenService = jwtTokenService;
        this.sessionRegistry = sessionRegistry;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        try {
            TokenClaims claims = jwtTokenService.validate(token, TokenType.ACCESS);
            if (sessionRegistry.isRevoked(claims.sessionId())) {
                throw AuthProblems.sessionRevoked();
            }
            authenticate(request, token, claims);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            log.info("Rejected bearer token on {}: {}", request.getRequestURI(), ex.getCode());
            problemResponseWriter.write(request, response, ex);
            return;
        } catch (DataAccessException ex) {
            SecurityContextHolder.clearContext();
            log.error("Revocation check unavailable on {}", request.getRequestURI(), ex);
            problemResponseWriter.write(request, response, AuthProblems.backendUnavailable(ex));
            return;
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    private static void authenticate(HttpServletRequest request, String token, TokenClaims claims) {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        claims.roles().forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
        claims.permissions().forEach(permission -> authorities.add(new SimpleGrantedAuthority(permission)));

        AuthenticatedIdentity principal = new AuthenticatedIdentity(
                claims.userId(),
                claims.email(),
                claims.roles(),
                claims.permissions(),
                claims.sessionId(),
                claims.expiresAt()
        );
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }
}
