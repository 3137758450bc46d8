package com.openforge.kairn.experience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * application.yml:
 *
 * kairn:
 *   experience:
 *     promotion-threshold: 5          # access count that flags auto-promotion
 *     default-prune-threshold: 0.01   # prune() without an explicit threshold
 */
@ConfigurationProperties(prefix = "kairn.experience")
public record ExperienceProperties(
        @DefaultValue("5")    int    promotionThreshold,
        @DefaultValue("0.01") double defaultPruneThreshold
) {}
