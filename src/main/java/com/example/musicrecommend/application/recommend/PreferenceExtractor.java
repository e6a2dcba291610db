package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.Outcome;
import com.example.musicrecommend.domain.model.PreferenceProfile;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns listening signals into a {@link PreferenceProfile}.
 * <p>
 * Three sources are supported: the tracks played in the current session,
 * a single current track, and the listener's accumulated history. An empty
 * source yields an empty {@link Outcome} with {@link EmptyReason#NO_SIGNAL}.
 */
@Component
public class PreferenceExtractor {

    /**
     * Preferences from every track played in this session: all their tags,
     * artists and languages.
     */
    public Outcome<PreferenceProfile> fromSession(List<Track> playedThisSession, Set<Long> likedIds) {
        if (playedThisSession == null || playedThisSession.isEmpty()) {
            return Outcome.empty(EmptyReason.NO_SIGNAL, "no tracks played this session");
        }
        Set<String> tags = new LinkedHashSet<>();
        Set<String> artists = new LinkedHashSet<>();
        Set<String> languages = new LinkedHashSet<>();
        for (Track track : playedThisSession) {
            if (track == null) {
                continue;
            }
            addNormalized(tags, track.getTags());
            addNormalized(artists, track.getArtist());
            addNormalized(languages, track.getLanguage());
        }
        return Outcome.of(new PreferenceProfile(tags, artists, languages, Collections.<Long, Double>emptyMap(), likedIds));
    }

    /**
     * Preferences for "more like this": the current track's own tags, artist
     * and language, plus the listener's minutes per track for the history term.
     */
    public Outcome<PreferenceProfile> fromCurrentTrack(Track current,
                                                       Collection<ListeningSignal> history,
                                                       Set<Long> likedIds) {
        if (current == null) {
            return Outcome.empty(EmptyReason.NO_SIGNAL, "no current track");
        }
        Set<String> tags = new LinkedHashSet<>();
        Set<String> artists = new LinkedHashSet<>();
        Set<String> languages = new LinkedHashSet<>();
        addNormalized(tags, current.getTags());
        addNormalized(artists, current.getArtist());
        addNormalized(languages, current.getLanguage());
        return Outcome.of(new PreferenceProfile(tags, artists, languages, accumulateMinutes(history), likedIds));
    }

    /**
     * Preferences from the listener's most listened tracks: the most frequent
     * tags and artists among them. Ties keep the order in which a tag or artist
     * was first seen, walking tracks from most to least listened.
     *
     * @param catalogById catalog used to resolve history track ids; unknown ids are skipped
     */
    public Outcome<PreferenceProfile> fromHistory(Collection<ListeningSignal> history,
                                                  Map<Long, Track> catalogById,
                                                  Set<Long> likedIds,
                                                  int topTracks,
                                                  int topTags,
                                                  int topArtists) {
        Map<Long, Double> minutesByTrack = accumulateMinutes(history);
        if (minutesByTrack.isEmpty()) {
            return Outcome.empty(EmptyReason.NO_SIGNAL, "listener has no history");
        }
        List<Track> mostListened = topTracksByMinutes(minutesByTrack, catalogById, topTracks);
        if (mostListened.isEmpty()) {
            return Outcome.empty(EmptyReason.NO_SIGNAL, "no history track found in catalog");
        }

        Map<String, Integer> tagCounts = new LinkedHashMap<>();
        Map<String, Integer> artistCounts = new LinkedHashMap<>();
        for (Track track : mostListened) {
            for (String tag : track.getTags()) {
                count(tagCounts, normalize(tag));
            }
            count(artistCounts, normalize(track.getArtist()));
        }

        return Outcome.of(new PreferenceProfile(
                mostFrequent(tagCounts, topTags),
                mostFrequent(artistCounts, topArtists),
                Collections.<String>emptySet(),
                minutesByTrack,
                likedIds));
    }

    /**
     * Sums minutes per track. Keys keep the order of first appearance.
     */
    public Map<Long, Double> accumulateMinutes(Collection<ListeningSignal> history) {
        Map<Long, Double> minutesByTrack = new LinkedHashMap<>();
        if (history == null) {
            return minutesByTrack;
        }
        for (ListeningSignal signal : history) {
            if (signal == null) {
                continue;
            }
            minutesByTrack.merge(signal.getTrackId(), signal.getMinutes(), Double::sum);
        }
        return minutesByTrack;
    }

    /**
     * Catalog tracks with the most accumulated minutes, descending. Equal
     * minutes keep history order.
     */
    public List<Track> topTracksByMinutes(Map<Long, Double> minutesByTrack, Map<Long, Track> catalogById, int limit) {
        if (limit <= 0 || minutesByTrack.isEmpty()) {
            return Collections.emptyList();
        }
        List<Map.Entry<Long, Double>> entries = new ArrayList<>(minutesByTrack.entrySet());
        entries.sort(Map.Entry.<Long, Double>comparingByValue().reversed());

        List<Track> result = new ArrayList<>(Math.min(limit, entries.size()));
        for (Map.Entry<Long, Double> entry : entries) {
            Track track = catalogById.get(entry.getKey());
            if (track == null) {
                continue;
            }
            result.add(track);
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static void addNormalized(Set<String> target, Collection<String> values) {
        for (String value : values) {
            addNormalized(target, value);
        }
    }

    private static void addNormalized(Set<String> target, String value) {
        String normalized = normalize(value);
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }

    private static void count(Map<String, Integer> counts, String key) {
        if (!key.isEmpty()) {
            counts.merge(key, 1, Integer::sum);
        }
    }

    private static Set<String> mostFrequent(Map<String, Integer> counts, int limit) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts stay in first-seen order
        entries.sort(new Comparator<Map.Entry<String, Integer>>() {
            @Override
            public int compare(Map.Entry<String, Integer> a, Map.Entry<String, Integer> b) {
                return Integer.compare(b.getValue(), a.getValue());
            }
        });
        Set<String> result = new LinkedHashSet<>();
        for (Map.Entry<String, Integer> entry : entries) {
            if (result.size() >= limit) {
                break;
            }
            result.add(entry.getKey());
        }
        return result;
    }
}
