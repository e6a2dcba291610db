package com.example.musicrecommend.application.service;

import com.example.musicrecommend.application.recommend.RecommendationEngine;
import com.example.musicrecommend.common.exception.ListeningDataException;
import com.example.musicrecommend.common.logging.AccessLogFilter;
import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.RecommendationStrategy;
import com.example.musicrecommend.domain.model.ExclusionSet;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.RecommendationResult;
import com.example.musicrecommend.domain.model.Track;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for song recommendations.
 * <p>
 * Each call fetches a fresh snapshot from the store, hands it to the
 * {@link RecommendationEngine} and never throws: read failures and empty
 * input come back as an empty {@link RecommendationResult} carrying the
 * reason (the history strategy serves the trending list instead).
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final ListeningSnapshotLoader snapshotLoader;
    private final RecommendationEngine engine;
    private final MeterRegistry meterRegistry;

    public RecommendationService(ListeningSnapshotLoader snapshotLoader,
                                 RecommendationEngine engine,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.snapshotLoader = snapshotLoader;
        this.engine = engine;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public RecommendationResult rankSessionRecommendations(String listenerId,
                                                           List<Track> playedThisSession,
                                                           Set<Long> excludeIds) {
        boolean noInput = playedThisSession == null || playedThisSession.isEmpty();
        return runSession(listenerId, noInput, excludeIds, snapshot -> playedThisSession);
    }

    /**
     * Session recommendations from track ids. Ids missing from the catalog are ignored.
     */
    public RecommendationResult recommendForSession(String listenerId,
                                                    Collection<Long> playedTrackIds,
                                                    Set<Long> excludeIds) {
        boolean noInput = playedTrackIds == null || playedTrackIds.isEmpty();
        return runSession(listenerId, noInput, excludeIds, snapshot -> resolve(playedTrackIds, snapshot));
    }

    public RecommendationResult rankContextualRecommendations(String listenerId,
                                                              Track currentTrack,
                                                              Set<Long> excludeIds) {
        return runContextual(listenerId, currentTrack == null, excludeIds, snapshot -> currentTrack);
    }

    /**
     * Contextual recommendations from a track id; an id missing from the
     * catalog gives an empty result.
     */
    public RecommendationResult recommendForTrack(String listenerId, Long currentTrackId, Set<Long> excludeIds) {
        return runContextual(listenerId, currentTrackId == null, excludeIds,
                snapshot -> snapshot.catalogById().get(currentTrackId));
    }

    public RecommendationResult rankHistoryRecommendations(String listenerId) {
        long startedAtNanos = System.nanoTime();
        RecommendationStrategy strategy = RecommendationStrategy.HISTORY;
        logStart(strategy, listenerId);
        try {
            ListeningSnapshot snapshot;
            try {
                snapshot = snapshotLoader.load(listenerId, true);
            } catch (ListeningDataException e) {
                if (e.getSource() != ListeningDataException.Source.HISTORY) {
                    throw e;
                }
                log.warn("RECOMMEND_EVENT event=history_read_failed strategy={} listener={} traceId={}",
                        strategy, safeListener(listenerId), currentTraceId(), e);
                ListeningSnapshot withoutHistory = snapshotLoader.load(listenerId, false);
                return finish(strategy, listenerId, engine.trendingFallback(
                        withoutHistory, EmptyReason.UPSTREAM_READ_FAILURE, "history read failed: " + e.getMessage()));
            }
            return finish(strategy, listenerId, engine.rankHistory(snapshot));
        } catch (ListeningDataException e) {
            return finish(strategy, listenerId, upstreamFailure(strategy, listenerId, e));
        } finally {
            recordDuration(strategy, System.nanoTime() - startedAtNanos);
        }
    }

    private RecommendationResult runSession(String listenerId,
                                            boolean noInput,
                                            Set<Long> excludeIds,
                                            Function<ListeningSnapshot, List<Track>> playedResolver) {
        long startedAtNanos = System.nanoTime();
        RecommendationStrategy strategy = RecommendationStrategy.SESSION;
        logStart(strategy, listenerId);
        try {
            if (noInput) {
                return finish(strategy, listenerId,
                        RecommendationResult.empty(strategy, EmptyReason.NO_SIGNAL, "no tracks played this session"));
            }
            ListeningSnapshot snapshot = snapshotLoader.load(listenerId, false);
            return finish(strategy, listenerId,
                    engine.rankSession(playedResolver.apply(snapshot), ExclusionSet.of(excludeIds), snapshot));
        } catch (ListeningDataException e) {
            return finish(strategy, listenerId, upstreamFailure(strategy, listenerId, e));
        } finally {
            recordDuration(strategy, System.nanoTime() - startedAtNanos);
        }
    }

    private RecommendationResult runContextual(String listenerId,
                                               boolean noInput,
                                               Set<Long> excludeIds,
                                               Function<ListeningSnapshot, Track> currentResolver) {
        long startedAtNanos = System.nanoTime();
        RecommendationStrategy strategy = RecommendationStrategy.CONTEXTUAL;
        logStart(strategy, listenerId);
        try {
            if (noInput) {
                return finish(strategy, listenerId,
                        RecommendationResult.empty(strategy, EmptyReason.NO_SIGNAL, "no current track"));
            }
            ListeningSnapshot snapshot = snapshotLoader.load(listenerId, true);
            Track current = currentResolver.apply(snapshot);
            if (current == null) {
                return finish(strategy, listenerId,
                        RecommendationResult.empty(strategy, EmptyReason.NO_SIGNAL, "current track not in catalog"));
            }
            return finish(strategy, listenerId, engine.rankContextual(current, ExclusionSet.of(excludeIds), snapshot));
        } catch (ListeningDataException e) {
            return finish(strategy, listenerId, upstreamFailure(strategy, listenerId, e));
        } finally {
            recordDuration(strategy, System.nanoTime() - startedAtNanos);
        }
    }

    private static List<Track> resolve(Collection<Long> trackIds, ListeningSnapshot snapshot) {
        Map<Long, Track> catalogById = snapshot.catalogById();
        List<Track> tracks = new ArrayList<>(trackIds.size());
        for (Long id : trackIds) {
            Track track = catalogById.get(id);
            if (track != null) {
                tracks.add(track);
            }
        }
        return tracks;
    }

    private RecommendationResult upstreamFailure(RecommendationStrategy strategy,
                                                 String listenerId,
                                                 ListeningDataException e) {
        log.warn("RECOMMEND_EVENT event=upstream_read_failure strategy={} listener={} source={} traceId={}",
                strategy, safeListener(listenerId), e.getSource(), currentTraceId(), e);
        return RecommendationResult.empty(strategy, EmptyReason.UPSTREAM_READ_FAILURE,
                e.getSource() + " read failed: " + e.getMessage());
    }

    private void logStart(RecommendationStrategy strategy, String listenerId) {
        log.debug("RECOMMEND_EVENT event=start strategy={} listener={} traceId={}",
                strategy, safeListener(listenerId), currentTraceId());
        recordCounter("music.recommend.request", "strategy", strategy.name());
    }

    private RecommendationResult finish(RecommendationStrategy strategy, String listenerId, RecommendationResult result) {
        if (result.isFallback()) {
            log.info("RECOMMEND_EVENT event=fallback strategy={} listener={} returned={} reason={} traceId={}",
                    strategy, safeListener(listenerId), result.getTracks().size(), result.getReason(), currentTraceId());
            recordCounter("music.recommend.fallback", "strategy", strategy.name(), "reason", result.getReason().name());
        } else if (result.getReason() != null) {
            log.info("RECOMMEND_EVENT event=degraded strategy={} listener={} reason={} detail={} traceId={}",
                    strategy, safeListener(listenerId), result.getReason(), result.getDetail(), currentTraceId());
            recordCounter("music.recommend.degraded", "strategy", strategy.name(), "reason", result.getReason().name());
        } else {
            log.info("RECOMMEND_EVENT event=success strategy={} listener={} returned={} traceId={}",
                    strategy, safeListener(listenerId), result.getTracks().size(), currentTraceId());
        }
        return result;
    }

    private String safeListener(String listenerId) {
        return StringUtils.hasText(listenerId) ? listenerId.trim() : "anonymous";
    }

    private String currentTraceId() {
        String traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Recommendation metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(RecommendationStrategy strategy, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer("music.recommend.latency", "strategy", strategy.name()).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Recommendation metric timer failed, strategy={}", strategy, ex);
        }
    }
}
