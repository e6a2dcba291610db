package com.example.musicrecommend.domain;

public enum RecommendationStrategy {

    /** Built from tracks played in the current session. */
    SESSION,

    /** Built around one current track plus the listener's history. */
    CONTEXTUAL,

    /** Built from the listener's most listened tracks, trending list when there is none. */
    HISTORY
}
