package com.hrms.backend.global.web;

import java.util.Set;

import com.hrms.backend.global.config.SecurityProperties;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the client address. Forwarding headers are honoured only when the direct peer is a
 * configured trusted proxy; otherwise they are attacker-controlled and ignored.
 */
@Component
public class ClientIpResolver {

    static final String X_REAL_IP = "X-Real-IP";
    static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final Set<String> trustedProxies;

    public ClientIpResolver(SecurityProperties properties) {
        this.trustedProxies = Set.copyOf(properties.getRateLimit().getTrustedProxies());
    }

    public String resolve(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        if (!trustedProxies.contains(remote)) {
            return remote;
        }
        String realIp = request.getHeader(X_REAL_IP);
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        String forwardedFor = request.getHeader(X_FORWARDED_FOR);
        if (StringUtils.hasText(forwardedFor)) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return remote;
    }

    public ClientContext contextOf(HttpServletRequest request) {
        return new ClientContext(
                resolve(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(HttpHeaders.ACCEPT_LANGUAGE)
        );
    }
}
