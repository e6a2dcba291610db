package com.example.musicrecommend.common.config;

import com.example.musicrecommend.domain.model.ScoringWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.recommend")
public class AppRecommendProperties {

    private StrategyProperties session = StrategyProperties.of(25, 30, 15, 10, 2.0D, 15, false);

    private StrategyProperties contextual = StrategyProperties.of(15, 25, 10, 8, 3.0D, 10, true);

    private StrategyProperties history = StrategyProperties.of(20, 25, 0, 10, 3.0D, 30, false);

    /**
     * How many of the listener's most listened tracks feed the history strategy.
     */
    private int historyTopTracks = 10;

    private int historyTopTags = 5;

    private int historyTopArtists = 3;

    private double historyWeightPerMinute = 2.0D;

    /**
     * Upper bound of the per-track history term, whatever the minutes listened.
     */
    private double historyWeightCap = 20.0D;

    private double likesFactor = 2.0D;

    private double viewsFactor = 1.0D;

    /**
     * Size of the trending list served when the listener has no history.
     */
    private int trendingLimit = 20;

    private int recentlyPlayedLimit = 9;

    /**
     * Fixed seed for score jitter. Leave unset in production so repeated calls vary.
     */
    private Long jitterSeed;

    /**
     * Budget for the parallel catalog/history/liked reads of one call.
     */
    private long fetchTimeoutMs = 3000L;

    private int fetchThreads = 4;

    public ScoringWeights sessionWeights() {
        return toWeights(session);
    }

    public ScoringWeights contextualWeights() {
        return toWeights(contextual);
    }

    public ScoringWeights historyWeights() {
        return toWeights(history);
    }

    private ScoringWeights toWeights(StrategyProperties strategy) {
        return ScoringWeights.builder()
                .tagWeight(strategy.getTagWeight())
                .artistBonus(strategy.getArtistBonus())
                .languageBonus(strategy.getLanguageBonus())
                .likedBonus(strategy.getLikedBonus())
                .historyWeightPerMinute(strategy.isHistoryWeightEnabled() ? historyWeightPerMinute : 0D)
                .historyWeightCap(strategy.isHistoryWeightEnabled() ? historyWeightCap : 0D)
                .likesFactor(likesFactor)
                .viewsFactor(viewsFactor)
                .maxJitter(strategy.getMaxJitter())
                .limit(strategy.getLimit())
                .build();
    }

    @Data
    public static class StrategyProperties {

        private double tagWeight;

        private double artistBonus;

        private double languageBonus;

        private double likedBonus;

        private double maxJitter;

        private int limit;

        /**
         * Whether minutes the listener already spent on a candidate add to its score.
         */
        private boolean historyWeightEnabled;

        static StrategyProperties of(double tagWeight,
                                     double artistBonus,
                                     double languageBonus,
                                     double likedBonus,
                                     double maxJitter,
                                     int limit,
                                     boolean historyWeightEnabled) {
            StrategyProperties properties = new StrategyProperties();
            properties.setTagWeight(tagWeight);
            properties.setArtistBonus(artistBonus);
            properties.setLanguageBonus(languageBonus);
            properties.setLikedBonus(likedBonus);
            properties.setMaxJitter(maxJitter);
            properties.setLimit(limit);
            properties.setHistoryWeightEnabled(historyWeightEnabled);
            return properties;
        }
    }
}
