package com.hrms.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under the auth persistence package. Audit timestamps come from the shared
 * {@link Clock} so that row times agree with token and session times.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.hrms.backend.modules.auth.infrastructure.persistence")
@EnableJpaAuditing(auditorAwareRef = "hrmsAuditorAware", dateTimeProviderRef = "clockDateTimeProvider")
public class JpaConfig {

    @Bean
    public AuditorAware<UUID> hrmsAuditorAware() {
        return new HrmsAuditorAware();
    }

    @Bean
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
