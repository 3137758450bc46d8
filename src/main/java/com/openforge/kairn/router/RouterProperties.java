package com.openforge.kairn.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * application.yml:
 *
 * kairn:
 *   router:
 *     max-keywords: 20      # tokens kept per node and per query
 *     min-confidence: 0.0   # route entries below this are ignored by resolve
 *     full-edge-limit: 10   # edges attached to each node at detail=full
 */
@ConfigurationProperties(prefix = "kairn.router")
public record RouterProperties(
        @DefaultValue("20")  int    maxKeywords,
        @DefaultValue("0.0") double minConfidence,
        @DefaultValue("10")  int    fullEdgeLimit
) {}
