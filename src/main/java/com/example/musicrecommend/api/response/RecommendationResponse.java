package com.example.musicrecommend.api.response;

import com.example.musicrecommend.domain.model.RecommendationResult;
import com.example.musicrecommend.domain.model.RecommendedTrack;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One strategy's ranked tracks. {@code reason} is present when the list is
 * empty or is the trending fallback.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResponse {

    private String strategy;
    private Boolean fallback;
    private String reason;
    private String detail;
    private List<TrackResponse> tracks;

    public static RecommendationResponse from(RecommendationResult result) {
        List<TrackResponse> tracks = new ArrayList<>(result.getTracks().size());
        for (RecommendedTrack track : result.getTracks()) {
            tracks.add(TrackResponse.from(track));
        }
        return new RecommendationResponse(
                result.getStrategy().name(),
                result.isFallback(),
                result.getReason() == null ? null : result.getReason().name(),
                result.getDetail(),
                tracks
        );
    }
}
