package com.example.musicrecommend.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * Everything one recommendation call reads from the store, fetched up front.
 * History and liked ids are empty when the call does not need them.
 */
@Getter
public final class ListeningSnapshot {

    private final List<Track> catalog;
    private final List<ListeningSignal> history;
    private final Set<Long> likedIds;

    public ListeningSnapshot(List<Track> catalog, List<ListeningSignal> history, Set<Long> likedIds) {
        this.catalog = catalog == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(catalog));
        this.history = history == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(history));
        this.likedIds = likedIds == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(likedIds));
    }

    /**
     * Catalog keyed by track id, first occurrence wins.
     */
    public Map<Long, Track> catalogById() {
        Map<Long, Track> byId = new LinkedHashMap<>();
        for (Track track : catalog) {
            byId.putIfAbsent(track.getId(), track);
        }
        return byId;
    }
}
