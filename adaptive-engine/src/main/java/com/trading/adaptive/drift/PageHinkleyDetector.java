package com.trading.adaptive.drift;

import java.time.Instant;

/**
 * Page-Hinkley test for an upward shift in the mean of a stream.
 *
 * <p>Each observation adds {@code x - lambda} to a cumulative sum; the test fires when the sum rises more
 * than {@code delta} above its running minimum, and then restarts from zero. Not thread-safe.
 */
public final class PageHinkleyDetector {
    private final double lambda;
    private final double delta;

    private double sum;
    private double minSum;
    private int driftCount;
    private Instant lastDriftTime;
    private double lastMagnitude;

    public PageHinkleyDetector(double lambda, double delta) {
        this.lambda = lambda;
        this.delta = delta;
    }

    /**
     * Feed one observation.
     *
     * @return true if this observation completed a drift
     */
    public boolean update(double x, Instant now) {
        sum += x - lambda;
        minSum = Math.min(minSum, sum);
        double magnitude = sum - minSum;

        if (magnitude > delta) {
            driftCount++;
            lastDriftTime = now;
            lastMagnitude = magnitude;
            reset();
            return true;
        }
        return false;
    }

    /** Restart the cumulative sums. Drift count and last drift time are kept. */
    public void reset() {
        sum = 0.0;
        minSum = 0.0;
    }

    public double sum() {
        return sum;
    }

    public double minSum() {
        return minSum;
    }

    public double magnitude() {
        return sum - minSum;
    }

    public double lastMagnitude() {
        return lastMagnitude;
    }

    public int driftCount() {
        return driftCount;
    }

    public Instant lastDriftTime() {
        return lastDriftTime;
    }

    public double delta() {
        return delta;
    }

    public State state() {
        return new State(sum, minSum, driftCount, lastDriftTime);
    }

    public void restore(State state) {
        this.sum = state.sum();
        this.minSum = state.minSum();
        this.driftCount = state.driftCount();
        this.lastDriftTime = state.lastDriftTime();
    }

    public record State(double sum, double minSum, int driftCount, Instant lastDriftTime) {
    }
}
