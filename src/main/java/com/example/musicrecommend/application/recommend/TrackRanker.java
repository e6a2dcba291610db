package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.domain.model.RecommendedTrack;
import com.example.musicrecommend.domain.model.ScoredCandidate;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class TrackRanker {

    private static final Comparator<ScoredCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredCandidate::getScore).reversed();

    /**
     * Top {@code limit} candidates by score, highest first. Fewer candidates
     * than the limit are all returned; a track id appears at most once.
     */
    public List<RecommendedTrack> select(List<ScoredCandidate> scored, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        if (scored == null || scored.isEmpty() || limit == 0) {
            return Collections.emptyList();
        }
        List<ScoredCandidate> sorted = new ArrayList<>(scored);
        sorted.sort(BY_SCORE_DESC);

        Set<Long> seen = new HashSet<>();
        List<RecommendedTrack> result = new ArrayList<>(Math.min(limit, sorted.size()));
        for (ScoredCandidate candidate : sorted) {
            if (!seen.add(candidate.getTrack().getId())) {
                continue;
            }
            result.add(candidate.toRecommendedTrack());
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    /**
     * Catalog ordered by the given popularity measure, highest first; equal
     * values keep catalog order.
     */
    public List<RecommendedTrack> byPopularity(List<Track> catalog,
                                               Comparator<Track> popularity,
                                               Set<Long> likedIds,
                                               int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        if (catalog == null || catalog.isEmpty() || limit == 0) {
            return Collections.emptyList();
        }
        List<Track> sorted = new ArrayList<>(catalog);
        sorted.sort(popularity.reversed());

        Set<Long> seen = new HashSet<>();
        List<RecommendedTrack> result = new ArrayList<>(Math.min(limit, sorted.size()));
        for (Track track : sorted) {
            if (!seen.add(track.getId())) {
                continue;
            }
            result.add(new RecommendedTrack(track, likedIds != null && likedIds.contains(track.getId())));
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    public static Comparator<Track> byViews() {
        return Comparator.comparingLong(Track::getViews);
    }

    public static Comparator<Track> byViewsPlusLikes() {
        return Comparator.comparingLong(track -> track.getViews() + track.getLikes());
    }
}
