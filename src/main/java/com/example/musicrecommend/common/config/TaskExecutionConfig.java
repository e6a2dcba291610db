package com.example.musicrecommend.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService recommendFetchExecutor;

    /**
     * Runs the catalog, history and liked reads of a recommendation call side by side.
     * A full queue rejects the read, which degrades that call instead of queueing it.
     */
    @Bean
    public ExecutorService recommendFetchExecutor(AppRecommendProperties appRecommendProperties) {
        int core = Math.max(3, appRecommendProperties.getFetchThreads());
        int max = core * 2;
        this.recommendFetchExecutor = new ThreadPoolExecutor(
                core,
                max,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(core * 50),
                new NamedThreadFactory("recommend-fetch-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.recommendFetchExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (recommendFetchExecutor != null) {
            recommendFetchExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
