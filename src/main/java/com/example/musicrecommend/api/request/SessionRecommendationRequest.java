package com.example.musicrecommend.api.request;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class SessionRecommendationRequest {

    @Size(max = 128, message = "listenerId must be at most 128 characters")
    private String listenerId;

    /**
     * Tracks actually played in this session, oldest first.
     */
    @NotNull(message = "playedTrackIds is required")
    @Size(max = 500, message = "playedTrackIds must contain at most 500 ids")
    private List<Long> playedTrackIds = new ArrayList<>();

    @Size(max = 2000, message = "excludeTrackIds must contain at most 2000 ids")
    private Set<Long> excludeTrackIds = new LinkedHashSet<>();
}
