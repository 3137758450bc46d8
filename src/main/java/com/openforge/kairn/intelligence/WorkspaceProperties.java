package com.openforge.kairn.intelligence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * application.yml:
 *
 * kairn:
 *   workspace:
 *     name: default   # label attached to crossref results
 */
@ConfigurationProperties(prefix = "kairn.workspace")
public record WorkspaceProperties(
        @DefaultValue("default") String name
) {}
