package com.example.musicrecommend.application.recommend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.Outcome;
import com.example.musicrecommend.domain.model.PreferenceProfile;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PreferenceExtractorTest {

    private final PreferenceExtractor extractor = new PreferenceExtractor();

    @Test
    void sessionProfileShouldNormalizeAndCollapseTagsAndArtists() {
        List<Track> played = Arrays.asList(
                track(1L, "  The Band ", "EN", "Rock", "POP"),
                track(2L, "the band", "en", "rock", "Indie"));

        Outcome<PreferenceProfile> outcome = extractor.fromSession(played, Collections.singleton(9L));

        assertTrue(outcome.isPresent());
        PreferenceProfile profile = outcome.get();
        assertEquals(new ArrayList<>(Arrays.asList("rock", "pop", "indie")), new ArrayList<>(profile.getTags()));
        assertEquals(Collections.singleton("the band"), profile.getArtists());
        assertEquals(Collections.singleton("en"), profile.getLanguages());
        assertTrue(profile.isLiked(9L));
        assertTrue(profile.getMinutesByTrack().isEmpty());
    }

    @Test
    void emptySessionShouldSignalNoSignal() {
        Outcome<PreferenceProfile> outcome = extractor.fromSession(Collections.<Track>emptyList(), Collections.<Long>emptySet());

        assertFalse(outcome.isPresent());
        assertEquals(EmptyReason.NO_SIGNAL, outcome.getReason());
    }

    @Test
    void currentTrackProfileShouldUseOwnAttributesAndSummedHistory() {
        Track current = track(5L, "Artist", "fr", "Jazz");
        List<ListeningSignal> history = Arrays.asList(
                new ListeningSignal(1L, 2.5D),
                new ListeningSignal(2L, 1D),
                new ListeningSignal(1L, 3.5D));

        PreferenceProfile profile = extractor.fromCurrentTrack(current, history, Collections.<Long>emptySet()).get();

        assertEquals(Collections.singleton("jazz"), profile.getTags());
        assertEquals(Collections.singleton("artist"), profile.getArtists());
        assertEquals(Collections.singleton("fr"), profile.getLanguages());
        assertEquals(6D, profile.minutesFor(1L), 1e-9);
        assertEquals(1D, profile.minutesFor(2L), 1e-9);
        assertEquals(0D, profile.minutesFor(3L), 1e-9);
    }

    @Test
    void missingCurrentTrackShouldSignalNoSignal() {
        Outcome<PreferenceProfile> outcome = extractor.fromCurrentTrack(null, null, null);

        assertEquals(EmptyReason.NO_SIGNAL, outcome.getReason());
    }

    @Test
    void historyProfileShouldRankTagsAndArtistsByFrequencyWithFirstSeenTieBreak() {
        Map<Long, Track> catalog = catalog(
                track(1L, "A", "en", "pop", "dance"),
                track(2L, "B", "en", "rock", "pop"),
                track(3L, "A", "en", "rock", "chill"),
                track(4L, "C", "en", "lofi"));
        List<ListeningSignal> history = Arrays.asList(
                new ListeningSignal(1L, 30D),
                new ListeningSignal(2L, 20D),
                new ListeningSignal(3L, 10D),
                new ListeningSignal(4L, 5D));

        PreferenceProfile profile = extractor.fromHistory(history, catalog, Collections.<Long>emptySet(), 10, 3, 2).get();

        // pop=2, rock=2 (pop seen first), dance=1 before chill and lofi
        assertEquals(Arrays.asList("pop", "rock", "dance"), new ArrayList<>(profile.getTags()));
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(profile.getArtists()));
        assertTrue(profile.getLanguages().isEmpty());
    }

    @Test
    void historyProfileShouldOnlyUseTopTracksByMinutes() {
        Map<Long, Track> catalog = catalog(
                track(1L, "Low", "en", "ambient"),
                track(2L, "High", "en", "metal"));
        List<ListeningSignal> history = Arrays.asList(
                new ListeningSignal(1L, 1D),
                new ListeningSignal(2L, 2D),
                new ListeningSignal(2L, 2D));

        PreferenceProfile profile = extractor.fromHistory(history, catalog, Collections.<Long>emptySet(), 1, 5, 3).get();

        assertEquals(Collections.singleton("metal"), profile.getTags());
        assertEquals(Collections.singleton("high"), profile.getArtists());
    }

    @Test
    void historyWithoutCatalogMatchesShouldSignalNoSignal() {
        Outcome<PreferenceProfile> outcome = extractor.fromHistory(
                Collections.singletonList(new ListeningSignal(42L, 10D)),
                catalog(track(1L, "A", "en", "pop")),
                Collections.<Long>emptySet(), 10, 5, 3);

        assertEquals(EmptyReason.NO_SIGNAL, outcome.getReason());
    }

    @Test
    void emptyHistoryShouldSignalNoSignal() {
        Outcome<PreferenceProfile> outcome = extractor.fromHistory(
                Collections.<ListeningSignal>emptyList(), catalog(), Collections.<Long>emptySet(), 10, 5, 3);

        assertEquals(EmptyReason.NO_SIGNAL, outcome.getReason());
    }

    @Test
    void topTracksByMinutesShouldKeepHistoryOrderOnTies() {
        Map<Long, Double> minutes = new LinkedHashMap<>();
        minutes.put(3L, 4D);
        minutes.put(1L, 9D);
        minutes.put(2L, 4D);
        Map<Long, Track> catalog = catalog(track(1L, "A", "en"), track(2L, "B", "en"), track(3L, "C", "en"));

        List<Track> top = extractor.topTracksByMinutes(minutes, catalog, 3);

        assertEquals(Arrays.asList(1L, 3L, 2L), Arrays.asList(top.get(0).getId(), top.get(1).getId(), top.get(2).getId()));
    }

    private static Track track(Long id, String artist, String language, String... tags) {
        return new Track(id, "Song-" + id, artist, language, Arrays.asList(tags), 0L, 0L);
    }

    private static Map<Long, Track> catalog(Track... tracks) {
        Map<Long, Track> byId = new LinkedHashMap<>();
        for (Track track : tracks) {
            byId.put(track.getId(), track);
        }
        return byId;
    }
}
