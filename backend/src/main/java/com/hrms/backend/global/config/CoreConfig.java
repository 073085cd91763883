package com.hrms.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Shared infrastructure beans: the UTC clock every security component reads time from,
 * the bound {@link SecurityProperties}, and async execution for outbound notifications.
 */
@Configuration
@EnableAsync
@EnableConfigurationProperties(SecurityProperties.class)
public class CoreConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
