package com.marketsync.alerting.rule;

import com.marketsync.common.ConfigurationException;
import com.marketsync.domain.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a deviation ratio to a severity: the highest step whose minRatio the ratio reaches.
 * A fired rule below the first step gets the first step's severity.
 */
public final class SeverityLadder {

    public record Step(double minRatio, Severity severity) {
    }

    private static final SeverityLadder DEFAULT = new SeverityLadder(List.of(
            new Step(1.0, Severity.MEDIUM),
            new Step(2.0, Severity.HIGH),
            new Step(4.0, Severity.CRITICAL)));

    private final List<Step> steps;

    public SeverityLadder(List<Step> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("Severity ladder needs at least one step");
        }
        List<Step> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingDouble(Step::minRatio));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).severity().compareTo(sorted.get(i - 1).severity()) < 0) {
                throw new ConfigurationException("Severity ladder must not de-escalate: " + sorted);
            }
        }
        this.steps = List.copyOf(sorted);
    }

    public static SeverityLadder defaultLadder() {
        return DEFAULT;
    }

    public Severity severityFor(double ratio) {
        Severity result = steps.get(0).severity();
        for (Step step : steps) {
            if (ratio >= step.minRatio()) {
                result = step.severity();
            }
        }
        return result;
    }

    public List<Step> steps() {
        return steps;
    }
}
