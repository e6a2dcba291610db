package com.example.musicrecommend.domain.model;

import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.RecommendationStrategy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Ranked tracks of one strategy call. {@code reason} is set when the list
 * is empty or is the trending fallback, so callers can report the cause.
 */
@Getter
@ToString
public final class RecommendationResult {

    private final RecommendationStrategy strategy;
    private final List<RecommendedTrack> tracks;
    private final boolean fallback;
    private final EmptyReason reason;
    private final String detail;

    private RecommendationResult(RecommendationStrategy strategy,
                                 List<RecommendedTrack> tracks,
                                 boolean fallback,
                                 EmptyReason reason,
                                 String detail) {
        this.strategy = strategy;
        this.tracks = tracks == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tracks));
        this.fallback = fallback;
        this.reason = reason;
        this.detail = detail;
    }

    public static RecommendationResult ranked(RecommendationStrategy strategy, List<RecommendedTrack> tracks) {
        return new RecommendationResult(strategy, tracks, false, null, null);
    }

    public static RecommendationResult fallback(RecommendationStrategy strategy,
                                                List<RecommendedTrack> tracks,
                                                EmptyReason reason,
                                                String detail) {
        return new RecommendationResult(strategy, tracks, true, reason, detail);
    }

    public static RecommendationResult empty(RecommendationStrategy strategy, EmptyReason reason, String detail) {
        return new RecommendationResult(strategy, Collections.<RecommendedTrack>emptyList(), false, reason, detail);
    }

    public boolean isEmpty() {
        return tracks.isEmpty();
    }

    public List<Long> trackIds() {
        List<Long> ids = new ArrayList<>(tracks.size());
        for (RecommendedTrack track : tracks) {
            ids.add(track.getTrackId());
        }
        return ids;
    }
}
