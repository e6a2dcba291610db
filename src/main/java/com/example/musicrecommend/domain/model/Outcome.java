package com.example.musicrecommend.domain.model;

import com.example.musicrecommend.domain.EmptyReason;
import java.util.NoSuchElementException;

/**
 * Result of a pipeline step that may legitimately have nothing to offer.
 * The orchestrator inspects it once instead of each step re-checking for empty input.
 */
public final class Outcome<T> {

    private final T value;
    private final EmptyReason reason;
    private final String detail;

    private Outcome(T value, EmptyReason reason, String detail) {
        this.value = value;
        this.reason = reason;
        this.detail = detail;
    }

    public static <T> Outcome<T> of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> empty(EmptyReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("reason is required");
        }
        return new Outcome<>(null, reason, detail);
    }

    public boolean isPresent() {
        return value != null;
    }

    public T get() {
        if (value == null) {
            throw new NoSuchElementException("empty outcome: " + reason);
        }
        return value;
    }

    public EmptyReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return value != null ? "Outcome[" + value + "]" : "Outcome[empty " + reason + ": " + detail + "]";
    }
}
