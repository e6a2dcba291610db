package com.example.musicrecommend.common.config;

import com.example.musicrecommend.application.recommend.RandomJitterSource;
import com.example.musicrecommend.domain.JitterSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecommendConfig {

    private static final Logger log = LoggerFactory.getLogger(RecommendConfig.class);

    @Bean
    public JitterSource jitterSource(AppRecommendProperties appRecommendProperties) {
        Long seed = appRecommendProperties.getJitterSeed();
        if (seed != null) {
            log.info("Score jitter seeded with {}, rankings are reproducible", seed);
            return RandomJitterSource.seeded(seed);
        }
        return RandomJitterSource.unseeded();
    }
}
