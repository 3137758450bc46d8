package com.openforge.kairn.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core infrastructure beans:
 *  - Clock        → the single time source for audit columns and decay math
 *  - ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * UTC wall clock. Relevance is computed lazily from (now, createTime),
     * so every component that needs "now" must read it from here.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared ObjectMapper for the flat tool-style API:
     *  - snake_case property names (node_id, min_relevance …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
