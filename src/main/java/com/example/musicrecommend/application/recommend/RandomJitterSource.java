package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.domain.JitterSource;
import java.util.Random;

/**
 * Uniform jitter backed by {@link Random}, seeded when reproducible rankings are wanted.
 * A seeded source hands every ranking pass a fresh {@code Random} on the same seed.
 */
public class RandomJitterSource implements JitterSource {

    private final Random random;
    private final Long seed;

    private RandomJitterSource(Random random, Long seed) {
        this.random = random;
        this.seed = seed;
    }

    public static RandomJitterSource seeded(long seed) {
        return new RandomJitterSource(new Random(seed), seed);
    }

    public static RandomJitterSource unseeded() {
        return new RandomJitterSource(new Random(), null);
    }

    @Override
    public JitterSource forPass() {
        return seed == null ? this : new RandomJitterSource(new Random(seed), seed);
    }

    @Override
    public double next(double bound) {
        if (bound <= 0D) {
            return 0D;
        }
        return random.nextDouble() * bound;
    }
}
