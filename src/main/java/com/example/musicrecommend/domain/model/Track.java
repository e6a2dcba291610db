package com.example.musicrecommend.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A catalog track as read from the store.
 * <p>
 * Like and view counts are a point-in-time read; the store owns them and
 * the recommendation engine never changes them.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public final class Track {

    private final Long id;
    private final String title;
    private final String artist;
    private final String language;
    /** Tags in catalog order, as stored. */
    private final List<String> tags;
    private final long likes;
    private final long views;

    public Track(Long id, String title, String artist, String language, List<String> tags, long likes, long views) {
        if (id == null) {
            throw new IllegalArgumentException("track id is required");
        }
        this.id = id;
        this.title = title == null ? "" : title;
        this.artist = artist == null ? "" : artist;
        this.language = language == null ? "" : language;
        this.tags = tags == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tags));
        this.likes = Math.max(0L, likes);
        this.views = Math.max(0L, views);
    }
}
