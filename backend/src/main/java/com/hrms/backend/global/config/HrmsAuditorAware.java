package com.hrms.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.global.security.AuthenticatedIdentity;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the acting user id for JPA auditing from the bearer-token identity.
 * Anonymous flows (login, password reset) have no auditor.
 */
public class HrmsAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedIdentity identity) {
            return Optional.ofNullable(identity.userId());
        }
        return Optional.empty();
    }
}
