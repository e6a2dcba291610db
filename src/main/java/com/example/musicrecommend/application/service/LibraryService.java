package com.example.musicrecommend.application.service;

import com.example.musicrecommend.application.recommend.PreferenceExtractor;
import com.example.musicrecommend.application.recommend.TrackRanker;
import com.example.musicrecommend.common.config.AppRecommendProperties;
import com.example.musicrecommend.common.exception.BusinessException;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.RecommendedTrack;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read-only listings around the recommendations: trending catalog,
 * recently played, liked and last played tracks.
 * Read failures propagate as {@code ListeningDataException}.
 */
@Service
public class LibraryService {

    private static final int DEFAULT_TRENDING_LIMIT = 50;
    private static final int MAX_TRENDING_LIMIT = 200;

    private final ListeningSnapshotLoader snapshotLoader;
    private final PreferenceExtractor preferenceExtractor;
    private final TrackRanker trackRanker;
    private final AppRecommendProperties properties;

    public LibraryService(ListeningSnapshotLoader snapshotLoader,
                          PreferenceExtractor preferenceExtractor,
                          TrackRanker trackRanker,
                          AppRecommendProperties properties) {
        this.snapshotLoader = snapshotLoader;
        this.preferenceExtractor = preferenceExtractor;
        this.trackRanker = trackRanker;
        this.properties = properties;
    }

    /**
     * Catalog ordered by views plus likes, highest first.
     */
    public List<RecommendedTrack> listTrending(String listenerId, Integer limit) {
        int safeLimit = limit == null ? DEFAULT_TRENDING_LIMIT : Math.max(1, Math.min(MAX_TRENDING_LIMIT, limit));
        ListeningSnapshot snapshot = snapshotLoader.load(listenerId, false);
        return trackRanker.byPopularity(snapshot.getCatalog(), TrackRanker.byViewsPlusLikes(),
                snapshot.getLikedIds(), safeLimit);
    }

    /**
     * The listener's most listened tracks by accumulated minutes.
     */
    public List<RecommendedTrack> listRecentlyPlayed(String listenerId) {
        requireListener(listenerId);
        ListeningSnapshot snapshot = snapshotLoader.load(listenerId, true);
        List<Track> top = preferenceExtractor.topTracksByMinutes(
                preferenceExtractor.accumulateMinutes(snapshot.getHistory()),
                snapshot.catalogById(),
                properties.getRecentlyPlayedLimit());
        List<RecommendedTrack> result = new ArrayList<>(top.size());
        for (Track track : top) {
            result.add(new RecommendedTrack(track, snapshot.getLikedIds().contains(track.getId())));
        }
        return result;
    }

    public List<RecommendedTrack> listLiked(String listenerId) {
        requireListener(listenerId);
        ListeningSnapshot snapshot = snapshotLoader.load(listenerId, false);
        List<RecommendedTrack> result = new ArrayList<>();
        for (Track track : snapshot.getCatalog()) {
            if (snapshot.getLikedIds().contains(track.getId())) {
                result.add(new RecommendedTrack(track, true));
            }
        }
        return result;
    }

    /**
     * @return the last started track, or {@code null} when unknown or no longer in the catalog
     */
    public RecommendedTrack lastPlayed(String listenerId) {
        requireListener(listenerId);
        Long lastTrackId = snapshotLoader.loadLastTrackId(listenerId);
        if (lastTrackId == null) {
            return null;
        }
        ListeningSnapshot snapshot = snapshotLoader.load(listenerId, false);
        Map<Long, Track> catalogById = snapshot.catalogById();
        Track track = catalogById.get(lastTrackId);
        if (track == null) {
            return null;
        }
        return new RecommendedTrack(track, snapshot.getLikedIds().contains(lastTrackId));
    }

    private static void requireListener(String listenerId) {
        if (!StringUtils.hasText(listenerId)) {
            throw BusinessException.badRequest("listenerId is required");
        }
    }
}
