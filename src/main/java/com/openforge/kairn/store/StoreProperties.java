package com.openforge.kairn.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bounds on store calls.
 *
 * application.yml:
 *
 * kairn:
 *   store:
 *     timeout: 10s    # max wait for the write permit, and transaction timeout
 */
@ConfigurationProperties(prefix = "kairn.store")
public record StoreProperties(
        @DefaultValue("10s") Duration timeout
) {}
