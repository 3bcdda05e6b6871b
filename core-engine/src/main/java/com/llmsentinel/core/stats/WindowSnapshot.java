package com.llmsentinel.core.stats;

/**
 * Immutable view of a {@link MetricWindow} taken right after an update.
 */
public final class WindowSnapshot {

    private final double mean;
    private final double std;
    private final double ewmaBaseline;
    private final boolean valid;
    private final long count;
    private final int size;

    WindowSnapshot(double mean, double std, double ewmaBaseline, boolean valid, long count, int size) {
        this.mean = mean;
        this.std = std;
        this.ewmaBaseline = ewmaBaseline;
        this.valid = valid;
        this.count = count;
        this.size = size;
    }

    public double getMean() {
        return mean;
    }

    /** Population standard deviation of the retained values. */
    public double getStd() {
        return std;
    }

    public double getEwmaBaseline() {
        return ewmaBaseline;
    }

    /** Whether enough observations have been seen to judge abnormality. */
    public boolean isValid() {
        return valid;
    }

    public long getCount() {
        return count;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "WindowSnapshot{" +
                "mean=" + mean +
                ", std=" + std +
                ", ewmaBaseline=" + ewmaBaseline +
                ", valid=" + valid +
                ", count=" + count +
                ", size=" + size +
                '}';
    }
}
