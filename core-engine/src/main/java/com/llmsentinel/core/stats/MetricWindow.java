package com.llmsentinel.core.stats;

import java.io.Serializable;

/**
 * Rolling statistics for a single metric.
 *
 * <p>
 * Keeps the most recent {@code capacity} raw values in a ring buffer together
 * with their mean and population variance, plus an exponentially weighted
 * moving average (EWMA) of every value ever observed.
 * </p>
 *
 * <h3>Statistics</h3>
 * <p>
 * While the buffer is filling, mean and variance are updated with Welford's
 * online algorithm. Once the buffer is full, each update evicts the oldest
 * value and recomputes both from the buffer (two-pass), so they always
 * describe exactly the retained values.
 * </p>
 *
 * <h3>EWMA</h3>
 * <p>
 * {@code ewma = alpha * value + (1 - alpha) * ewma}; the first observation
 * initialises it. The EWMA does not depend on the buffer and keeps following
 * values that have already been evicted.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The owning registry serializes access per metric.
 * Callers must reject non-finite values before calling {@link #update(double)}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_MIN_POINTS = 10;
    public static final double DEFAULT_EWMA_ALPHA = 0.1;

    private final int capacity;
    private final int minPoints;
    private final double ewmaAlpha;

    /** Ring buffer; {@code head} is the index of the oldest value. */
    private final double[] buffer;
    private int head;
    private int size;

    /** Total observations since creation (not capped by capacity). */
    private long count;
    private double mean;

    /** Sum of squared differences from the mean over the retained values. */
    private double m2;

    private double ewmaBaseline;

    public MetricWindow() {
        this(DEFAULT_CAPACITY, DEFAULT_MIN_POINTS, DEFAULT_EWMA_ALPHA);
    }

    /**
     * @param capacity  maximum number of retained values; must be &gt; 0
     * @param minPoints observations required before the window is valid;
     *                  must be &gt;= 1
     * @param ewmaAlpha smoothing factor in (0, 1]
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public MetricWindow(int capacity, int minPoints, double ewmaAlpha) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints must be >= 1, got: " + minPoints);
        }
        if (!(ewmaAlpha > 0 && ewmaAlpha <= 1)) {
            throw new IllegalArgumentException("ewmaAlpha must be in (0, 1], got: " + ewmaAlpha);
        }
        this.capacity = capacity;
        this.minPoints = minPoints;
        this.ewmaAlpha = ewmaAlpha;
        this.buffer = new double[capacity];
    }

    /**
     * Rebuild a window from previously captured state.
     *
     * <p>
     * The retained values are replayed oldest first; if there are more than
     * {@code capacity}, only the most recent ones are kept. The observation
     * count and EWMA are then set to the captured values.
     * </p>
     *
     * @param values       retained values, oldest first
     * @param count        total observations at capture time; raised to
     *                     {@code values.length} if smaller
     * @param ewmaBaseline EWMA at capture time
     */
    public static MetricWindow fromHistory(int capacity, int minPoints, double ewmaAlpha,
            double[] values, long count, double ewmaBaseline) {
        MetricWindow window = new MetricWindow(capacity, minPoints, ewmaAlpha);
        int from = Math.max(0, values.length - capacity);
        for (int i = from; i < values.length; i++) {
            window.update(values[i]);
        }
        if (values.length > 0) {
            window.count = Math.max(count, values.length);
            window.ewmaBaseline = ewmaBaseline;
        }
        return window;
    }

    /**
     * Record a new value and return the resulting statistics.
     *
     * @param value a finite value
     * @return snapshot after the update
     */
    public WindowSnapshot update(double value) {
        count++;

        if (size < capacity) {
            buffer[(head + size) % capacity] = value;
            size++;
            double delta = value - mean;
            mean += delta / size;
            m2 += delta * (value - mean);
        } else {
            // Overwrite the oldest slot and move head forward
            buffer[head] = value;
            head = (head + 1) % capacity;
            recompute();
        }
        if (m2 < 0) {
            m2 = 0;
        }

        ewmaBaseline = count == 1
                ? value
                : ewmaAlpha * value + (1 - ewmaAlpha) * ewmaBaseline;

        return snapshot();
    }

    /**
     * @return the current statistics without modifying the window
     */
    public WindowSnapshot snapshot() {
        return new WindowSnapshot(mean, getStd(), ewmaBaseline, isValid(), count, size);
    }

    /**
     * @return copy of the retained values, oldest first
     */
    public double[] values() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = buffer[(head + i) % capacity];
        }
        return copy;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int getCapacity() {
        return capacity;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public long getCount() {
        return count;
    }

    public int size() {
        return size;
    }

    public double getMean() {
        return mean;
    }

    /** Population variance of the retained values. */
    public double getVariance() {
        return size > 0 ? m2 / size : 0.0;
    }

    public double getStd() {
        return Math.sqrt(getVariance());
    }

    public double getEwmaBaseline() {
        return ewmaBaseline;
    }

    public boolean isValid() {
        return count >= minPoints;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void recompute() {
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += buffer[i];
        }
        double newMean = sum / size;

        double sumSquaredDiff = 0;
        for (int i = 0; i < size; i++) {
            double diff = buffer[i] - newMean;
            sumSquaredDiff += diff * diff;
        }
        mean = newMean;
        m2 = sumSquaredDiff;
    }

    @Override
    public String toString() {
        return "MetricWindow{" +
                "capacity=" + capacity +
                ", size=" + size +
                ", count=" + count +
                ", mean=" + mean +
                ", std=" + getStd() +
                ", ewmaBaseline=" + ewmaBaseline +
                '}';
    }
}
