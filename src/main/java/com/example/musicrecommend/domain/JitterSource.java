package com.example.musicrecommend.domain;

/**
 * Source of the bounded random addend applied last to every score.
 */
public interface JitterSource {

    /**
     * @param bound exclusive upper bound, zero or negative means no jitter
     * @return a value in {@code [0, bound)}
     */
    double next(double bound);

    /**
     * Source for one ranking pass. Seeded sources restart from their seed so
     * identical inputs get identical jitter; others return themselves.
     */
    default JitterSource forPass() {
        return this;
    }

    static JitterSource none() {
        return bound -> 0D;
    }
}
