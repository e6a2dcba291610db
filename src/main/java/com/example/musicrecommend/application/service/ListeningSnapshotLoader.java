package com.example.musicrecommend.application.service;

import com.example.musicrecommend.application.port.ListeningDataSource;
import com.example.musicrecommend.common.config.AppRecommendProperties;
import com.example.musicrecommend.common.exception.ListeningDataException;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fetches catalog, history and liked ids for one call. The reads are
 * independent, so they run in parallel on {@code recommendFetchExecutor}
 * and are awaited together; scoring only starts once all of them are in.
 */
@Service
public class ListeningSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(ListeningSnapshotLoader.class);

    private final ListeningDataSource dataSource;
    private final ExecutorService fetchExecutor;
    private final AppRecommendProperties properties;

    public ListeningSnapshotLoader(ListeningDataSource dataSource,
                                   @Qualifier("recommendFetchExecutor") ExecutorService fetchExecutor,
                                   AppRecommendProperties properties) {
        this.dataSource = dataSource;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    /**
     * @param listenerId    listener whose liked ids (and history) are read; blank means anonymous
     * @param includeHistory whether the listener's history is needed
     * @throws ListeningDataException when any read fails or the fetch budget runs out; reads
     *                                still running at that point are cancelled with an interrupt
     */
    public ListeningSnapshot load(String listenerId, boolean includeHistory) {
        boolean known = StringUtils.hasText(listenerId);
        List<Future<?>> submitted = new ArrayList<>(3);
        try {
            Future<List<Track>> catalog = submit(submitted, ListeningDataException.Source.CATALOG,
                    dataSource::listCatalog);
            Future<List<ListeningSignal>> history = includeHistory && known
                    ? submit(submitted, ListeningDataException.Source.HISTORY, () -> dataSource.listHistory(listenerId))
                    : CompletableFuture.completedFuture(Collections.<ListeningSignal>emptyList());
            Future<Set<Long>> liked = known
                    ? submit(submitted, ListeningDataException.Source.LIKED, () -> dataSource.listLikedIds(listenerId))
                    : CompletableFuture.completedFuture(Collections.<Long>emptySet());

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getFetchTimeoutMs());
            return new ListeningSnapshot(
                    await(catalog, ListeningDataException.Source.CATALOG, deadline),
                    await(history, ListeningDataException.Source.HISTORY, deadline),
                    await(liked, ListeningDataException.Source.LIKED, deadline));
        } catch (ListeningDataException e) {
            cancelAll(submitted);
            throw e;
        }
    }

    public Long loadLastTrackId(String listenerId) {
        try {
            return dataSource.findLastTrackId(listenerId);
        } catch (RuntimeException e) {
            throw new ListeningDataException(ListeningDataException.Source.LISTENER,
                    "failed to read last track of listener " + listenerId, e);
        }
    }

    private <T> Future<T> submit(List<Future<?>> submitted, ListeningDataException.Source source, Supplier<T> read) {
        try {
            Future<T> future = fetchExecutor.submit(() -> {
                try {
                    T value = read.get();
                    if (value == null) {
                        throw new IllegalStateException(source + " read returned null");
                    }
                    return value;
                } catch (ListeningDataException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new ListeningDataException(source, source + " read failed", e);
                }
            });
            submitted.add(future);
            return future;
        } catch (RejectedExecutionException e) {
            log.warn("RECOMMEND_FETCH event=rejected source={}", source);
            throw new ListeningDataException(source, source + " read rejected, fetch pool saturated", e);
        }
    }

    private <T> T await(Future<T> future, ListeningDataException.Source source, long deadlineNanos) {
        try {
            return future.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("RECOMMEND_FETCH event=timeout source={} budgetMs={}", source, properties.getFetchTimeoutMs());
            throw new ListeningDataException(source,
                    "listening data fetch exceeded " + properties.getFetchTimeoutMs() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ListeningDataException(source, source + " read interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ListeningDataException) {
                throw (ListeningDataException) cause;
            }
            throw new ListeningDataException(source, source + " read failed", cause);
        }
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }
}
