package com.example.musicrecommend.infrastructure.persistence;

import com.example.musicrecommend.application.port.ListeningDataSource;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.Track;
import com.example.musicrecommend.infrastructure.persistence.entity.ListeningHistoryEntity;
import com.example.musicrecommend.infrastructure.persistence.entity.TrackEntity;
import com.example.musicrecommend.infrastructure.persistence.mapper.LikedTrackMapper;
import com.example.musicrecommend.infrastructure.persistence.mapper.ListenerMapper;
import com.example.musicrecommend.infrastructure.persistence.mapper.ListeningHistoryMapper;
import com.example.musicrecommend.infrastructure.persistence.mapper.TrackMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MyBatisListeningDataSource implements ListeningDataSource {

    private static final Logger log = LoggerFactory.getLogger(MyBatisListeningDataSource.class);

    private final TrackMapper trackMapper;
    private final ListeningHistoryMapper listeningHistoryMapper;
    private final LikedTrackMapper likedTrackMapper;
    private final ListenerMapper listenerMapper;

    public MyBatisListeningDataSource(TrackMapper trackMapper,
                                      ListeningHistoryMapper listeningHistoryMapper,
                                      LikedTrackMapper likedTrackMapper,
                                      ListenerMapper listenerMapper) {
        this.trackMapper = trackMapper;
        this.listeningHistoryMapper = listeningHistoryMapper;
        this.likedTrackMapper = likedTrackMapper;
        this.listenerMapper = listenerMapper;
    }

    @Override
    public List<Track> listCatalog() {
        List<TrackEntity> rows = trackMapper.selectAllActive();
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<Track> tracks = new ArrayList<>(rows.size());
        for (TrackEntity row : rows) {
            if (row.getId() == null) {
                continue;
            }
            tracks.add(toTrack(row));
        }
        log.debug("Loaded catalog: tracks={}", tracks.size());
        return tracks;
    }

    @Override
    public List<ListeningSignal> listHistory(String listenerId) {
        List<ListeningHistoryEntity> rows = listeningHistoryMapper.selectByListener(listenerId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<ListeningSignal> signals = new ArrayList<>(rows.size());
        for (ListeningHistoryEntity row : rows) {
            if (row.getTrackId() == null) {
                continue;
            }
            double minutes = row.getMinutesListened() == null ? 0D : row.getMinutesListened();
            signals.add(new ListeningSignal(row.getTrackId(), minutes));
        }
        return signals;
    }

    @Override
    public Set<Long> listLikedIds(String listenerId) {
        List<Long> ids = likedTrackMapper.selectTrackIdsByListener(listenerId);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Long> liked = new LinkedHashSet<>(ids);
        liked.remove(null);
        return liked;
    }

    @Override
    public Long findLastTrackId(String listenerId) {
        return listenerMapper.selectLastTrackId(listenerId);
    }

    static Track toTrack(TrackEntity row) {
        return new Track(
                row.getId(),
                row.getTitle(),
                row.getArtist(),
                row.getLanguage(),
                splitTags(row.getTags()),
                row.getLikes() == null ? 0L : row.getLikes(),
                row.getViews() == null ? 0L : row.getViews());
    }

    static List<String> splitTags(String tags) {
        if (!StringUtils.hasText(tags)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String part : tags.split(",")) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                result.add(tag);
            }
        }
        return result;
    }
}
