package com.example.musicrecommend.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A candidate with its score for a single ranking pass. Scores of
 * different passes are not comparable.
 */
@Getter
@ToString
public final class ScoredCandidate {

    private final Track track;
    private final double score;
    private final boolean liked;

    public ScoredCandidate(Track track, double score, boolean liked) {
        this.track = track;
        this.score = score;
        this.liked = liked;
    }

    public RecommendedTrack toRecommendedTrack() {
        return new RecommendedTrack(track, liked);
    }
}
