package com.marketsync.alerting.rule;

import com.marketsync.domain.BucketGranularity;

/**
 * One row of the alert rule table.
 */
public record AlertRule(
        String id,
        String type,
        AlertMetric metric,
        ComparisonOperator operator,
        double threshold,
        BucketGranularity granularity,
        SeverityLadder severityLadder
) {

    public boolean fires(double value) {
        return operator.test(value, threshold);
    }
}
