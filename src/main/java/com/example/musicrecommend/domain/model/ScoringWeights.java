package com.example.musicrecommend.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-strategy constants of the additive score. The values are tuning knobs,
 * not derived from each other.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ScoringWeights {

    /** Added once per candidate tag found in the preferred tags. */
    private final double tagWeight;

    private final double artistBonus;

    private final double languageBonus;

    private final double likedBonus;

    /** History term is {@code min(minutes * historyWeightPerMinute, historyWeightCap)}; zero cap disables it. */
    private final double historyWeightPerMinute;

    private final double historyWeightCap;

    private final double likesFactor;

    private final double viewsFactor;

    /** Exclusive upper bound of the random addend. */
    private final double maxJitter;

    /** Maximum number of tracks returned. */
    private final int limit;
}
