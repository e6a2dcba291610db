package com.example.musicrecommend.domain;

/**
 * Why a recommendation call produced no personalized list.
 */
public enum EmptyReason {

    /** No usable listening signal: nothing played, no history, unknown current track. */
    NO_SIGNAL,

    /** Every catalog track was filtered out, or the catalog is empty. */
    NO_CANDIDATES,

    /** A read from the store failed or timed out. */
    UPSTREAM_READ_FAILURE
}
