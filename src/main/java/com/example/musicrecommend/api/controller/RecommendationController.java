package com.example.musicrecommend.api.controller;

import com.example.musicrecommend.api.request.ContextualRecommendationRequest;
import com.example.musicrecommend.api.request.SessionRecommendationRequest;
import com.example.musicrecommend.api.response.ApiResponse;
import com.example.musicrecommend.api.response.RecommendationResponse;
import com.example.musicrecommend.application.service.RecommendationService;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Song recommendations.
 *
 * <pre>
 *   POST /api/v1/recommendations/session
 *   POST /api/v1/recommendations/contextual
 *   GET  /api/v1/recommendations/history?listenerId=
 * </pre>
 *
 * A degraded call still answers code "0": the list is empty (or trending)
 * and {@code reason} says why.
 */
@Validated
@RestController
@RequestMapping("/api/v1/recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @PostMapping("/session")
    public ApiResponse<RecommendationResponse> session(@Valid @RequestBody SessionRecommendationRequest request) {
        return ApiResponse.success(RecommendationResponse.from(recommendationService.recommendForSession(
                request.getListenerId(), request.getPlayedTrackIds(), request.getExcludeTrackIds())));
    }

    @PostMapping("/contextual")
    public ApiResponse<RecommendationResponse> contextual(@Valid @RequestBody ContextualRecommendationRequest request) {
        return ApiResponse.success(RecommendationResponse.from(recommendationService.recommendForTrack(
                request.getListenerId(), request.getCurrentTrackId(), request.getExcludeTrackIds())));
    }

    @GetMapping("/history")
    public ApiResponse<RecommendationResponse> history(@RequestParam("listenerId") @NotBlank String listenerId) {
        return ApiResponse.success(RecommendationResponse.from(
                recommendationService.rankHistoryRecommendations(listenerId)));
    }
}
