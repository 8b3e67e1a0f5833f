package com.fairway.eventmodel;

/**
 * Direction in which an event type moves net revenue.
 */
public enum Polarity {
    POSITIVE(1),
    NEGATIVE(-1),
    NEUTRAL(0);

    private final int signum;

    Polarity(int signum) {
        this.signum = signum;
    }

    /** {@code 1}, {@code -1} or {@code 0}. */
    public int signum() {
        return signum;
    }
}
