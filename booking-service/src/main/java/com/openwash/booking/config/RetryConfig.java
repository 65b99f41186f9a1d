package com.openwash.booking.config;

import com.openwash.common.exception.ConcurrencyConflictException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry used around allocating writes. A lost reservation race is retried once in a fresh
 * transaction; nothing else is retried here.
 */
@Configuration
public class RetryConfig {

    @Value("${booking.allocation.conflict-attempts:2}")
    private int conflictAttempts;

    @Bean
    public RetryTemplate allocationRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(conflictAttempts)
                .retryOn(ConcurrencyConflictException.class)
                .noBackoff()
                .build();
    }
}
