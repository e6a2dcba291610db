package com.example.musicrecommend.api.controller;

import com.example.musicrecommend.api.response.ApiResponse;
import com.example.musicrecommend.api.response.TrackResponse;
import com.example.musicrecommend.application.service.LibraryService;
import com.example.musicrecommend.domain.model.RecommendedTrack;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class LibraryController {

    private final LibraryService libraryService;

    public LibraryController(LibraryService libraryService) {
        this.libraryService = libraryService;
    }

    @GetMapping("/tracks/trending")
    public ApiResponse<List<TrackResponse>> trending(
            @RequestParam(value = "listenerId", required = false) String listenerId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(toResponses(libraryService.listTrending(listenerId, limit)));
    }

    @GetMapping("/listeners/{listenerId}/recently-played")
    public ApiResponse<List<TrackResponse>> recentlyPlayed(@PathVariable("listenerId") String listenerId) {
        return ApiResponse.success(toResponses(libraryService.listRecentlyPlayed(listenerId)));
    }

    @GetMapping("/listeners/{listenerId}/liked")
    public ApiResponse<List<TrackResponse>> liked(@PathVariable("listenerId") String listenerId) {
        return ApiResponse.success(toResponses(libraryService.listLiked(listenerId)));
    }

    @GetMapping("/listeners/{listenerId}/last-played")
    public ApiResponse<TrackResponse> lastPlayed(@PathVariable("listenerId") String listenerId) {
        RecommendedTrack track = libraryService.lastPlayed(listenerId);
        return ApiResponse.success(track == null ? null : TrackResponse.from(track));
    }

    private static List<TrackResponse> toResponses(List<RecommendedTrack> tracks) {
        return tracks.stream().map(TrackResponse::from).collect(Collectors.toList());
    }
}
