package com.example.musicrecommend.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One history entry of a listener: a track and the minutes spent on it.
 * Several signals for the same track add up.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ListeningSignal {

    private final Long trackId;
    private final double minutes;

    public ListeningSignal(Long trackId, double minutes) {
        if (trackId == null) {
            throw new IllegalArgumentException("trackId is required");
        }
        this.trackId = trackId;
        this.minutes = Double.isNaN(minutes) ? 0D : Math.max(0D, minutes);
    }
}
