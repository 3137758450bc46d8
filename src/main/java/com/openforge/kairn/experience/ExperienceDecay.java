package com.openforge.kairn.experience;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.ExperienceType;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Decay math. Pure functions, no clock of its own.
 *
 *   decayRate = ln(2) × confidenceMultiplier / baseHalfLifeDays
 *   relevance = score × exp(−decayRate × ageInDays)
 *
 * The multiplier is applied before the division so that LOW is exactly 4×
 * and MEDIUM exactly 2× the HIGH rate in floating point.
 */
public final class ExperienceDecay {

    private static final double LN2        = Math.log(2.0);
    private static final double MS_PER_DAY = 86_400_000d;

    private ExperienceDecay() {
    }

    public static double decayRate(ExperienceType type, Confidence confidence) {
        return LN2 * confidence.decayMultiplier() / type.baseHalfLifeDays();
    }

    /** Days for relevance to halve at the given rate. */
    public static double halfLifeDays(double decayRate) {
        return LN2 / decayRate;
    }

    /** Fractional days from {@code created} to {@code now}; never negative. */
    public static double ageInDays(LocalDateTime created, LocalDateTime now) {
        if (created == null || now == null || !now.isAfter(created)) {
            return 0.0;
        }
        return Duration.between(created, now).toMillis() / MS_PER_DAY;
    }

    public static double relevance(double score, double decayRate, double ageInDays) {
        if (ageInDays <= 0.0) {
            return score;
        }
        return score * Math.exp(-decayRate * ageInDays);
    }
}
