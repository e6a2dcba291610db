package com.example.musicrecommend.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class RecommendedTrack {

    private final Track track;
    private final boolean liked;

    public RecommendedTrack(Track track, boolean liked) {
        this.track = track;
        this.liked = liked;
    }

    public Long getTrackId() {
        return track.getId();
    }
}
