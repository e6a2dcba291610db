package com.example.musicrecommend.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/**
 * Preferences derived for one ranking call. Tags and artists are already
 * lower-cased and trimmed; languages are lower-cased. Never persisted.
 */
@Getter
@ToString
public final class PreferenceProfile {

    private final Set<String> tags;
    private final Set<String> artists;
    private final Set<String> languages;
    private final Map<Long, Double> minutesByTrack;
    private final Set<Long> likedIds;

    public PreferenceProfile(Set<String> tags,
                             Set<String> artists,
                             Set<String> languages,
                             Map<Long, Double> minutesByTrack,
                             Set<Long> likedIds) {
        this.tags = freeze(tags);
        this.artists = freeze(artists);
        this.languages = freeze(languages);
        this.minutesByTrack = minutesByTrack == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(minutesByTrack));
        this.likedIds = freeze(likedIds);
    }

    public double minutesFor(Long trackId) {
        Double minutes = minutesByTrack.get(trackId);
        return minutes == null ? 0D : minutes;
    }

    public boolean isLiked(Long trackId) {
        return likedIds.contains(trackId);
    }

    private static <T> Set<T> freeze(Set<T> values) {
        return values == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
