package com.example.musicrecommend.application.recommend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musicrecommend.common.config.AppRecommendProperties;
import com.example.musicrecommend.common.config.RecommendConfig;
import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.JitterSource;
import com.example.musicrecommend.domain.RecommendationStrategy;
import com.example.musicrecommend.domain.model.ExclusionSet;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.RecommendationResult;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecommendationEngineTest {

    private static final Track A = new Track(1L, "A", "X", "en", Arrays.asList("pop", "rock"), 10L, 100L);
    private static final Track B = new Track(2L, "B", "Y", "en", Collections.singletonList("rock"), 5L, 50L);
    private static final Track C = new Track(3L, "C", "Z", "en", Collections.singletonList("jazz"), 1L, 5L);

    private final AppRecommendProperties properties = new AppRecommendProperties();

    @Test
    void contextualScenarioShouldFavorSharedTagAndPopularity() {
        ListeningSnapshot snapshot = new ListeningSnapshot(
                Arrays.asList(A, B, C),
                Collections.singletonList(new ListeningSignal(1L, 5D)),
                Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none()).rankContextual(B, ExclusionSet.empty(), snapshot);

        assertEquals(RecommendationStrategy.CONTEXTUAL, result.getStrategy());
        assertEquals(Arrays.asList(1L, 3L), result.trackIds());
        assertNull(result.getReason());

        TrackScorer scorer = new TrackScorer(JitterSource.none());
        PreferenceExtractor extractor = new PreferenceExtractor();
        double scoreA = scorer.scoreWithoutJitter(A,
                extractor.fromCurrentTrack(B, snapshot.getHistory(), snapshot.getLikedIds()).get(),
                properties.contextualWeights());
        // rock 15 + language 10 + history min(5*2,20) + popularity
        assertEquals(15D + 10D + 10D + 2D * Math.log(11D) + Math.log(101D), scoreA, 1e-9);
    }

    @Test
    void contextualShouldExcludeCurrentAndListenedTracks() {
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(A, B, C),
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none())
                .rankContextual(B, ExclusionSet.of(Collections.singleton(1L)), snapshot);

        assertEquals(Collections.singletonList(3L), result.trackIds());
    }

    @Test
    void contextualShouldApplyLikedFlags() {
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(A, B, C),
                Collections.<ListeningSignal>emptyList(), Collections.singleton(3L));

        RecommendationResult result = engine(JitterSource.none()).rankContextual(B, ExclusionSet.empty(), snapshot);

        assertFalse(result.getTracks().get(0).isLiked());
        assertTrue(result.getTracks().get(1).isLiked());
    }

    @Test
    void sessionShouldPreferTracksSharingTagsAndArtistAndSkipPlayedOnes() {
        Track d = new Track(4L, "D", "X", "en", Collections.singletonList("pop"), 0L, 0L);
        Track e = new Track(5L, "E", "Q", "fr", Collections.singletonList("metal"), 0L, 100000L);
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(A, B, C, d, e),
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none()).rankSession(
                Collections.singletonList(A), ExclusionSet.of(Collections.singleton(3L)), snapshot);

        // D: pop 25 + artist 30 + en 15; B: rock 25 + en 15 + popularity; E: popularity only
        assertEquals(Arrays.asList(4L, 2L, 5L), result.trackIds());
    }

    @Test
    void sessionWithoutPlayedTracksShouldBeEmptyWithoutTrending() {
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(A, B, C),
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none())
                .rankSession(Collections.<Track>emptyList(), ExclusionSet.empty(), snapshot);

        assertTrue(result.isEmpty());
        assertFalse(result.isFallback());
        assertEquals(EmptyReason.NO_SIGNAL, result.getReason());
    }

    @Test
    void sessionShouldCapOutputAtFifteen() {
        List<Track> catalog = new ArrayList<>();
        for (long id = 1; id <= 40; id++) {
            catalog.add(new Track(id, "S" + id, "Artist", "en", Collections.singletonList("pop"), id, id));
        }
        ListeningSnapshot snapshot = new ListeningSnapshot(catalog,
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());

        RecommendationResult result = engine(RandomJitterSource.unseeded())
                .rankSession(Collections.singletonList(catalog.get(0)), ExclusionSet.empty(), snapshot);

        assertEquals(15, result.getTracks().size());
        assertEquals(15, new HashSet<>(result.trackIds()).size());
        assertFalse(result.trackIds().contains(1L));
    }

    @Test
    void historyWithoutSignalsShouldFallBackToTrendingByViews() {
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(C, A, B),
                Collections.<ListeningSignal>emptyList(), Collections.singleton(2L));

        RecommendationResult result = engine(JitterSource.none()).rankHistory(snapshot);

        assertTrue(result.isFallback());
        assertEquals(EmptyReason.NO_SIGNAL, result.getReason());
        assertEquals(Arrays.asList(1L, 2L, 3L), result.trackIds());
        assertFalse(result.getTracks().get(0).isLiked());
        assertTrue(result.getTracks().get(1).isLiked());
    }

    @Test
    void trendingFallbackShouldCapAtTwenty() {
        List<Track> catalog = new ArrayList<>();
        for (long id = 1; id <= 30; id++) {
            catalog.add(new Track(id, "S" + id, "Artist", "en", Collections.<String>emptyList(), 0L, id * 10));
        }
        ListeningSnapshot snapshot = new ListeningSnapshot(catalog,
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none()).rankHistory(snapshot);

        assertEquals(20, result.getTracks().size());
        assertEquals(Long.valueOf(30L), result.trackIds().get(0));
        assertEquals(Long.valueOf(11L), result.trackIds().get(19));
    }

    @Test
    void historyShouldExcludeAllHistoryTracksAndUseFrequentTagsAndArtists() {
        Track rockByX = new Track(10L, "R", "X", "en", Collections.singletonList("rock"), 0L, 0L);
        Track jazzByW = new Track(11L, "J", "W", "en", Collections.singletonList("jazz"), 0L, 0L);
        ListeningSnapshot snapshot = new ListeningSnapshot(
                Arrays.asList(A, B, C, rockByX, jazzByW),
                Arrays.asList(new ListeningSignal(1L, 40D), new ListeningSignal(2L, 20D), new ListeningSignal(3L, 1D)),
                Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none()).rankHistory(snapshot);

        assertFalse(result.isFallback());
        // rock(2) and artist x: 20 + 25; jazz from C: 20
        assertEquals(Arrays.asList(10L, 11L), result.trackIds());
    }

    @Test
    void historyCoveringWholeCatalogShouldBeEmpty() {
        ListeningSnapshot snapshot = new ListeningSnapshot(Arrays.asList(A, B),
                Arrays.asList(new ListeningSignal(1L, 1D), new ListeningSignal(2L, 1D)),
                Collections.<Long>emptySet());

        RecommendationResult result = engine(JitterSource.none()).rankHistory(snapshot);

        assertTrue(result.isEmpty());
        assertEquals(EmptyReason.NO_CANDIDATES, result.getReason());
    }

    @Test
    void seededJitterShouldMakeOrderingReproducible() {
        List<Track> catalog = new ArrayList<>();
        for (long id = 1; id <= 25; id++) {
            catalog.add(new Track(id, "S" + id, "Artist" + id, "en", Collections.singletonList("pop"), 0L, 0L));
        }
        ListeningSnapshot snapshot = new ListeningSnapshot(catalog,
                Collections.<ListeningSignal>emptyList(), Collections.<Long>emptySet());
        Track current = new Track(100L, "Now", "Someone", "en", Collections.singletonList("pop"), 0L, 0L);

        properties.setJitterSeed(2024L);
        RecommendationEngine engine = engine(new RecommendConfig().jitterSource(properties));

        List<Long> first = engine.rankContextual(current, ExclusionSet.empty(), snapshot).trackIds();
        List<Long> second = engine.rankContextual(current, ExclusionSet.empty(), snapshot).trackIds();
        List<Long> session = engine.rankSession(Collections.singletonList(current), ExclusionSet.empty(), snapshot)
                .trackIds();

        assertEquals(10, first.size());
        assertEquals(first, second);
        assertEquals(session, engine.rankSession(Collections.singletonList(current), ExclusionSet.empty(), snapshot)
                .trackIds());
    }

    @Test
    void excludedIdsShouldNeverAppearInAnyStrategy() {
        List<Track> catalog = new ArrayList<>();
        for (long id = 1; id <= 30; id++) {
            catalog.add(new Track(id, "S" + id, "Artist" + (id % 3), "en", Collections.singletonList("t" + (id % 4)), id, id));
        }
        Set<Long> excluded = new HashSet<>(Arrays.asList(2L, 5L, 8L, 13L, 21L));
        ListeningSnapshot snapshot = new ListeningSnapshot(catalog,
                Arrays.asList(new ListeningSignal(3L, 9D), new ListeningSignal(4L, 2D)),
                Collections.<Long>emptySet());
        RecommendationEngine engine = engine(RandomJitterSource.unseeded());

        List<Long> session = engine.rankSession(Collections.singletonList(catalog.get(0)),
                ExclusionSet.of(excluded), snapshot).trackIds();
        List<Long> contextual = engine.rankContextual(catalog.get(6), ExclusionSet.of(excluded), snapshot).trackIds();
        List<Long> history = engine.rankHistory(snapshot).trackIds();

        for (Long id : excluded) {
            assertFalse(session.contains(id));
            assertFalse(contextual.contains(id));
        }
        assertFalse(session.contains(1L));
        assertFalse(contextual.contains(7L));
        assertFalse(history.contains(3L));
        assertFalse(history.contains(4L));
        assertEquals(28, history.size());
    }

    private RecommendationEngine engine(JitterSource jitterSource) {
        return new RecommendationEngine(
                new PreferenceExtractor(),
                new CandidateFilter(),
                new TrackScorer(jitterSource),
                new TrackRanker(),
                properties);
    }
}
