package com.marketsync.alerting.rule;

import com.marketsync.common.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated rule table keyed by rule id.
 */
public class AlertRuleRegistry {

    private final Map<String, AlertRule> rules;

    public AlertRuleRegistry(Collection<AlertRule> rules) {
        Map<String, AlertRule> byId = new LinkedHashMap<>();
        for (AlertRule rule : rules) {
            if (byId.putIfAbsent(rule.id(), rule) != null) {
                throw new ConfigurationException("Duplicate alert rule " + rule.id());
            }
        }
        this.rules = Collections.unmodifiableMap(byId);
    }

    public AlertRule get(String ruleId) {
        AlertRule rule = rules.get(ruleId);
        if (rule == null) {
            throw new ConfigurationException("Unknown alert rule " + ruleId);
        }
        return rule;
    }

    public boolean contains(String ruleId) {
        return rules.containsKey(ruleId);
    }

    public List<AlertRule> all() {
        return List.copyOf(rules.values());
    }
}
