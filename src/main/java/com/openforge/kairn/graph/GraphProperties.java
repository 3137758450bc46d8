package com.openforge.kairn.graph;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * application.yml:
 *
 * kairn:
 *   graph:
 *     auto-link: false   # connect each new node to up to 5 text-matching nodes
 */
@ConfigurationProperties(prefix = "kairn.graph")
public record GraphProperties(
        @DefaultValue("false") boolean autoLink
) {}
