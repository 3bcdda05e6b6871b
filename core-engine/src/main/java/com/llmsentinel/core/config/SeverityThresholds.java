package com.llmsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * |z| boundaries that map an anomaly's magnitude to a severity.
 *
 * <pre>
 * severity:
 *   sev1: 6.0    # |z| &gt;= sev1          -&gt; SEV-1
 *   sev2: 4.5    # sev2 &lt;= |z| &lt; sev1   -&gt; SEV-2
 *                # otherwise            -&gt; SEV-3
 * </pre>
 *
 * <p>
 * {@link #validate()} requires {@code sev1 >= sev2 > 0}, which keeps severity
 * monotonic in |z|.
 * </p>
 */
public class SeverityThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_SEV1 = 6.0;
    public static final double DEFAULT_SEV2 = 4.5;

    private double sev1 = DEFAULT_SEV1;
    private double sev2 = DEFAULT_SEV2;

    public SeverityThresholds() {
    }

    public SeverityThresholds(double sev1, double sev2) {
        this.sev1 = sev1;
        this.sev2 = sev2;
    }

    /**
     * @throws IllegalStateException if the boundaries are not ordered
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (!(sev2 > 0) || Double.isInfinite(sev2)) {
            errors.add("'sev2' must be a finite value > 0, got: " + sev2);
        }
        if (!(sev1 >= sev2) || Double.isInfinite(sev1)) {
            errors.add("'sev1' must be finite and >= 'sev2' (" + sev2 + "), got: " + sev1);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid severity thresholds: " + String.join("; ", errors));
        }
    }

    public double getSev1() {
        return sev1;
    }

    public void setSev1(double sev1) {
        this.sev1 = sev1;
    }

    public double getSev2() {
        return sev2;
    }

    public void setSev2(double sev2) {
        this.sev2 = sev2;
    }

    @Override
    public String toString() {
        return "SeverityThresholds{sev1=" + sev1 + ", sev2=" + sev2 + '}';
    }
}
