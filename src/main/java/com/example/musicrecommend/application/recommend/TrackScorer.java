package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.domain.JitterSource;
import com.example.musicrecommend.domain.model.PreferenceProfile;
import com.example.musicrecommend.domain.model.ScoredCandidate;
import com.example.musicrecommend.domain.model.ScoringWeights;
import com.example.musicrecommend.domain.model.Track;
import org.springframework.stereotype.Component;

/**
 * Additive relevance score of a candidate against a preference profile.
 * <p>
 * score = tag overlap + artist match + language match + history weight
 * + popularity + liked bonus + jitter. Each term has its own method so it
 * can be checked in isolation; jitter is added once, last.
 */
@Component
public class TrackScorer {

    private final JitterSource jitterSource;

    public TrackScorer(JitterSource jitterSource) {
        this.jitterSource = jitterSource == null ? JitterSource.none() : jitterSource;
    }

    public ScoredCandidate score(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        return score(candidate, profile, weights, jitterSource);
    }

    /**
     * Scores with the jitter of one ranking pass, see {@link #jitterForPass()}.
     */
    public ScoredCandidate score(Track candidate, PreferenceProfile profile, ScoringWeights weights, JitterSource jitter) {
        double score = scoreWithoutJitter(candidate, profile, weights);
        score += jitter.next(weights.getMaxJitter());
        return new ScoredCandidate(candidate, score, profile.isLiked(candidate.getId()));
    }

    public JitterSource jitterForPass() {
        return jitterSource.forPass();
    }

    public double scoreWithoutJitter(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        return tagOverlap(candidate, profile, weights)
                + artistMatch(candidate, profile, weights)
                + languageMatch(candidate, profile, weights)
                + historyWeight(profile.minutesFor(candidate.getId()), weights)
                + popularity(candidate.getLikes(), candidate.getViews(), weights)
                + likedBonus(candidate, profile, weights);
    }

    /**
     * Weight times the number of candidate tags present in the preferred tags.
     * Repeated tags on the candidate count each time.
     */
    public double tagOverlap(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        if (profile.getTags().isEmpty()) {
            return 0D;
        }
        int matches = 0;
        for (String tag : candidate.getTags()) {
            if (profile.getTags().contains(PreferenceExtractor.normalize(tag))) {
                matches++;
            }
        }
        return matches * weights.getTagWeight();
    }

    public double artistMatch(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        String artist = PreferenceExtractor.normalize(candidate.getArtist());
        return !artist.isEmpty() && profile.getArtists().contains(artist) ? weights.getArtistBonus() : 0D;
    }

    public double languageMatch(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        String language = PreferenceExtractor.normalize(candidate.getLanguage());
        return !language.isEmpty() && profile.getLanguages().contains(language) ? weights.getLanguageBonus() : 0D;
    }

    /**
     * {@code min(minutes * perMinute, cap)}; never above the cap.
     */
    public double historyWeight(double minutes, ScoringWeights weights) {
        if (minutes <= 0D || weights.getHistoryWeightCap() <= 0D) {
            return 0D;
        }
        return Math.min(minutes * weights.getHistoryWeightPerMinute(), weights.getHistoryWeightCap());
    }

    /**
     * {@code ln(1 + likes) * likesFactor + ln(1 + views) * viewsFactor}.
     */
    public double popularity(long likes, long views, ScoringWeights weights) {
        return Math.log1p(Math.max(0L, likes)) * weights.getLikesFactor()
                + Math.log1p(Math.max(0L, views)) * weights.getViewsFactor();
    }

    public double likedBonus(Track candidate, PreferenceProfile profile, ScoringWeights weights) {
        return profile.isLiked(candidate.getId()) ? weights.getLikedBonus() : 0D;
    }
}
