package com.creditgate.ratelimit;

/**
 * Raw result of a leaky bucket operation: whether one unit was added and the level afterwards.
 */
public final class BucketSnapshot {

    private final boolean admitted;
    private final double level;

    public BucketSnapshot(boolean admitted, double level) {
        this.admitted = admitted;
        this.level = level;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public double getLevel() {
        return level;
    }
}
