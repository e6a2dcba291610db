package com.example.musicrecommend.application.port;

import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.Track;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the store the recommendation engine works from.
 * Implementations may throw any runtime exception on a failed read.
 */
public interface ListeningDataSource {

    List<Track> listCatalog();

    List<ListeningSignal> listHistory(String listenerId);

    Set<Long> listLikedIds(String listenerId);

    /**
     * Track the listener last started, or {@code null} if unknown.
     */
    Long findLastTrackId(String listenerId);
}
