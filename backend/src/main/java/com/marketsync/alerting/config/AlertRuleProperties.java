package com.marketsync.alerting.config;

import com.marketsync.alerting.rule.AlertMetric;
import com.marketsync.alerting.rule.AlertRule;
import com.marketsync.alerting.rule.ComparisonOperator;
import com.marketsync.alerting.rule.SeverityLadder;
import com.marketsync.common.ConfigurationException;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.Severity;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alert rule table and sink settings (marketsync.alerts.*).
 */
@ConfigurationProperties(prefix = "marketsync.alerts")
@NoArgsConstructor
@Getter
@Setter
public class AlertRuleProperties {

    private Map<String, RuleDefinition> rules = new LinkedHashMap<>();

    /** Webhook sink endpoint; the sink is not registered when blank. */
    private String webhookUrl;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RuleDefinition {
        /** Alert type written on raised alerts; defaults to the rule id. */
        private String type;
        private AlertMetric metric;
        private ComparisonOperator operator;
        private Double threshold;
        private BucketGranularity granularity = BucketGranularity.HOURLY;
        /** Empty means the default ladder (≥1 MEDIUM, ≥2 HIGH, ≥4 CRITICAL). */
        private List<LadderStep> severityLadder = new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class LadderStep {
        private double minRatio;
        private Severity severity;
    }

    public List<AlertRule> toRules() {
        List<AlertRule> result = new ArrayList<>();
        for (Map.Entry<String, RuleDefinition> e : rules.entrySet()) {
            String id = e.getKey();
            RuleDefinition d = e.getValue();
            if (d.getMetric() == null || d.getOperator() == null || d.getThreshold() == null) {
                throw new ConfigurationException("Alert rule " + id + " needs metric, operator and threshold");
            }
            if (d.getGranularity() == null) {
                throw new ConfigurationException("Alert rule " + id + " needs a granularity");
            }
            SeverityLadder ladder = d.getSeverityLadder().isEmpty()
                    ? SeverityLadder.defaultLadder()
                    : new SeverityLadder(d.getSeverityLadder().stream()
                            .map(s -> {
                                if (s.getSeverity() == null) {
                                    throw new ConfigurationException("Alert rule " + id + " has a ladder step without severity");
                                }
                                return new SeverityLadder.Step(s.getMinRatio(), s.getSeverity());
                            })
                            .toList());
            String type = d.getType() == null || d.getType().isBlank() ? id : d.getType();
            result.add(new AlertRule(id, type, d.getMetric(), d.getOperator(), d.getThreshold(), d.getGranularity(), ladder));
        }
        return result;
    }
}
