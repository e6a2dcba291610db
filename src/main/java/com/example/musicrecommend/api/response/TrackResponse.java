package com.example.musicrecommend.api.response;

import com.example.musicrecommend.domain.model.RecommendedTrack;
import com.example.musicrecommend.domain.model.Track;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackResponse {

    private Long id;
    private String title;
    private String artist;
    private String language;
    private List<String> tags;
    private Long likes;
    private Long views;
    private Boolean liked;

    public static TrackResponse from(RecommendedTrack recommended) {
        Track track = recommended.getTrack();
        return new TrackResponse(
                track.getId(),
                track.getTitle(),
                track.getArtist(),
                track.getLanguage(),
                track.getTags(),
                track.getLikes(),
                track.getViews(),
                recommended.isLiked()
        );
    }
}
