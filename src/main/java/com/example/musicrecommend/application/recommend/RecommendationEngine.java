package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.common.config.AppRecommendProperties;
import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.JitterSource;
import com.example.musicrecommend.domain.RecommendationStrategy;
import com.example.musicrecommend.domain.model.ExclusionSet;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.Outcome;
import com.example.musicrecommend.domain.model.PreferenceProfile;
import com.example.musicrecommend.domain.model.RecommendationResult;
import com.example.musicrecommend.domain.model.RecommendedTrack;
import com.example.musicrecommend.domain.model.ScoredCandidate;
import com.example.musicrecommend.domain.model.ScoringWeights;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Wires extractor, filter, scorer and ranker into the three strategies.
 * <p>
 * Works on an already fetched {@link ListeningSnapshot}: no I/O, no shared
 * mutable state, safe to call concurrently. Empty outcomes from the
 * extractor or the filter are turned into results here and nowhere else.
 */
@Component
public class RecommendationEngine {

    private final PreferenceExtractor preferenceExtractor;
    private final CandidateFilter candidateFilter;
    private final TrackScorer trackScorer;
    private final TrackRanker trackRanker;
    private final AppRecommendProperties properties;

    public RecommendationEngine(PreferenceExtractor preferenceExtractor,
                                CandidateFilter candidateFilter,
                                TrackScorer trackScorer,
                                TrackRanker trackRanker,
                                AppRecommendProperties properties) {
        this.preferenceExtractor = preferenceExtractor;
        this.candidateFilter = candidateFilter;
        this.trackScorer = trackScorer;
        this.trackRanker = trackRanker;
        this.properties = properties;
    }

    /**
     * "Smart" recommendations from what was played in this session. Played
     * tracks are never recommended back. No trending substitute: an empty
     * session gives an empty result.
     */
    public RecommendationResult rankSession(List<Track> playedThisSession,
                                            ExclusionSet excludeIds,
                                            ListeningSnapshot snapshot) {
        Outcome<PreferenceProfile> profile =
                preferenceExtractor.fromSession(playedThisSession, snapshot.getLikedIds());
        if (!profile.isPresent()) {
            return empty(RecommendationStrategy.SESSION, profile);
        }
        ExclusionSet exclusions = safe(excludeIds).plusAll(idsOf(playedThisSession));
        Outcome<List<Track>> candidates = candidateFilter.filter(snapshot.getCatalog(), exclusions, null);
        if (!candidates.isPresent()) {
            return empty(RecommendationStrategy.SESSION, candidates);
        }
        return rank(RecommendationStrategy.SESSION, candidates.get(), profile.get(), properties.sessionWeights());
    }

    /**
     * Tracks similar to {@code currentTrack}, boosted by the listener's own history.
     */
    public RecommendationResult rankContextual(Track currentTrack,
                                               ExclusionSet excludeIds,
                                               ListeningSnapshot snapshot) {
        Outcome<PreferenceProfile> profile = preferenceExtractor.fromCurrentTrack(
                currentTrack, snapshot.getHistory(), snapshot.getLikedIds());
        if (!profile.isPresent()) {
            return empty(RecommendationStrategy.CONTEXTUAL, profile);
        }
        Outcome<List<Track>> candidates =
                candidateFilter.filter(snapshot.getCatalog(), safe(excludeIds), currentTrack.getId());
        if (!candidates.isPresent()) {
            return empty(RecommendationStrategy.CONTEXTUAL, candidates);
        }
        return rank(RecommendationStrategy.CONTEXTUAL, candidates.get(), profile.get(), properties.contextualWeights());
    }

    /**
     * Personal top list from the listener's most listened tracks. Tracks already
     * in the history are left out. Without history the trending list is served.
     */
    public RecommendationResult rankHistory(ListeningSnapshot snapshot) {
        Map<Long, Track> catalogById = snapshot.catalogById();
        Outcome<PreferenceProfile> profile = preferenceExtractor.fromHistory(
                snapshot.getHistory(),
                catalogById,
                snapshot.getLikedIds(),
                properties.getHistoryTopTracks(),
                properties.getHistoryTopTags(),
                properties.getHistoryTopArtists());
        if (!profile.isPresent()) {
            return trendingFallback(snapshot, profile.getReason(), profile.getDetail());
        }
        ExclusionSet historyIds = ExclusionSet.of(preferenceExtractor.accumulateMinutes(snapshot.getHistory()).keySet());
        Outcome<List<Track>> candidates = candidateFilter.filter(snapshot.getCatalog(), historyIds, null);
        if (!candidates.isPresent()) {
            return empty(RecommendationStrategy.HISTORY, candidates);
        }
        return rank(RecommendationStrategy.HISTORY, candidates.get(), profile.get(), properties.historyWeights());
    }

    /**
     * Catalog by view count, liked flags applied.
     */
    public List<RecommendedTrack> trending(ListeningSnapshot snapshot, int limit) {
        return trackRanker.byPopularity(snapshot.getCatalog(), TrackRanker.byViews(), snapshot.getLikedIds(), limit);
    }

    public RecommendationResult trendingFallback(ListeningSnapshot snapshot, EmptyReason reason, String detail) {
        List<RecommendedTrack> trending = trending(snapshot, properties.getTrendingLimit());
        if (trending.isEmpty()) {
            return RecommendationResult.empty(RecommendationStrategy.HISTORY, EmptyReason.NO_CANDIDATES,
                    "no history and catalog is empty");
        }
        return RecommendationResult.fallback(RecommendationStrategy.HISTORY, trending, reason, detail);
    }

    private RecommendationResult rank(RecommendationStrategy strategy,
                                      List<Track> candidates,
                                      PreferenceProfile profile,
                                      ScoringWeights weights) {
        JitterSource jitter = trackScorer.jitterForPass();
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Track candidate : candidates) {
            scored.add(trackScorer.score(candidate, profile, weights, jitter));
        }
        return RecommendationResult.ranked(strategy, trackRanker.select(scored, weights.getLimit()));
    }

    private static RecommendationResult empty(RecommendationStrategy strategy, Outcome<?> outcome) {
        return RecommendationResult.empty(strategy, outcome.getReason(), outcome.getDetail());
    }

    private static ExclusionSet safe(ExclusionSet exclusions) {
        return exclusions == null ? ExclusionSet.empty() : exclusions;
    }

    private static List<Long> idsOf(List<Track> tracks) {
        List<Long> ids = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            if (track != null) {
                ids.add(track.getId());
            }
        }
        return ids;
    }
}
