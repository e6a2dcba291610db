package com.example.musicrecommend.api.request;

import java.util.LinkedHashSet;
import java.util.Set;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ContextualRecommendationRequest {

    @NotBlank(message = "listenerId is required")
    @Size(max = 128, message = "listenerId must be at most 128 characters")
    private String listenerId;

    @NotNull(message = "currentTrackId is required")
    @Positive(message = "currentTrackId must be positive")
    private Long currentTrackId;

    /**
     * Tracks already listened to in this queue; they are not suggested again.
     */
    @Size(max = 2000, message = "excludeTrackIds must contain at most 2000 ids")
    private Set<Long> excludeTrackIds = new LinkedHashSet<>();
}
