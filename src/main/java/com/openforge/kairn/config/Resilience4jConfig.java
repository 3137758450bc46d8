package com.openforge.kairn.config;

import com.openforge.kairn.store.StoreProperties;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance is pre-wired:
 *   • "workspaceWrites" — a single-permit bulkhead that admits at most one
 *                         mutating transaction per workspace at a time.
 *
 * Callers that cannot get the permit within kairn.store.timeout fail with
 * BulkheadFullException instead of queueing forever (see WorkspaceTransactions).
 * No Retry is registered: a rejected write is surfaced, never replayed.
 */
@Configuration
public class Resilience4jConfig {

    public static final String WORKSPACE_WRITES = "workspaceWrites";

    // ── Bulkhead ─────────────────────────────────────────────────────────────

    @Bean
    public BulkheadRegistry bulkheadRegistry(StoreProperties storeProperties) {
        BulkheadConfig config = BulkheadConfig.custom()
                // one in-flight mutation per workspace
                .maxConcurrentCalls(1)
                // bounded by the caller's invocation timeout
                .maxWaitDuration(storeProperties.timeout())
                .build();

        BulkheadRegistry registry = BulkheadRegistry.of(config);
        registry.bulkhead(WORKSPACE_WRITES);
        return registry;
    }

    @Bean
    public Bulkhead workspaceWriteBulkhead(BulkheadRegistry registry) {
        return registry.bulkhead(WORKSPACE_WRITES);
    }
}
