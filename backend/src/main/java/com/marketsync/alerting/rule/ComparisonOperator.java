package com.marketsync.alerting.rule;

/**
 * Rule comparison. {@link #ratio} is the deviation ratio fed to the severity ladder; for LT/LTE it grows as the
 * value falls further below the threshold, for positive and negative thresholds alike.
 */
public enum ComparisonOperator {
    GT,
    GTE,
    LT,
    LTE,
    ABS_GT;

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case GTE -> value >= threshold;
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case ABS_GT -> Math.abs(value) > Math.abs(threshold);
        };
    }

    public double ratio(double value, double threshold) {
        double v = Math.abs(value);
        double t = Math.abs(threshold);
        if (this == LT || this == LTE) {
            if (threshold < 0.0) {
                return value / threshold;
            }
            if (threshold == 0.0) {
                return Double.POSITIVE_INFINITY;
            }
            return v == 0.0 ? Double.POSITIVE_INFINITY : t / v;
        }
        return t == 0.0 ? Double.POSITIVE_INFINITY : v / t;
    }
}
