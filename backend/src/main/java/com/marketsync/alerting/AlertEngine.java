package com.marketsync.alerting;

import com.marketsync.aggregation.BucketRange;
import com.marketsync.alerting.rule.AlertRule;
import com.marketsync.alerting.rule.AlertRuleRegistry;
import com.marketsync.domain.Alert;
import com.marketsync.domain.AlertRaisedEvent;
import com.marketsync.domain.AlertRepository;
import com.marketsync.ingestion.store.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Evaluates table-driven rules for one entity and window. A rule fires at most once per (entity, rule, windowStart):
 * the alert is inserted under a unique dedupKey and a duplicate insert means it was already raised.
 * Raised alerts are published as {@link AlertRaisedEvent} for the sinks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEngine {

    private final AlertRuleRegistry alertRuleRegistry;
    private final AlertMetricResolver alertMetricResolver;
    private final AlertRepository alertRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /** Evaluates every configured rule of the window's granularity. */
    public List<Alert> evaluate(String entity, BucketRange window) {
        return evaluate(entity, window, alertRuleRegistry.all());
    }

    /**
     * @return alerts raised by this call; already-raised alerts are not returned again
     */
    public List<Alert> evaluate(String entity, BucketRange window, List<AlertRule> rules) {
        List<Alert> raised = new ArrayList<>();
        for (AlertRule rule : rules) {
            if (rule.granularity() != window.granularity()) {
                continue;
            }
            OptionalDouble value = alertMetricResolver.resolve(rule.metric(), entity, window);
            if (value.isEmpty()) {
                continue;
            }
            Optional<Alert> candidate = toAlert(rule, entity, window, value.getAsDouble(), clock.instant());
            candidate.flatMap(this::insertOnce).ifPresent(raised::add);
        }
        return raised;
    }

    /**
     * Pure rule evaluation: an alert when the rule fires, with severity from the rule's ladder.
     */
    static Optional<Alert> toAlert(AlertRule rule, String entity, BucketRange window, double value, Instant now) {
        if (!rule.fires(value)) {
            return Optional.empty();
        }
        double ratio = rule.operator().ratio(value, rule.threshold());
        Alert alert = new Alert();
        alert.setDedupKey(Alert.dedupKeyOf(rule.id(), entity, window.start()));
        alert.setRuleId(rule.id());
        alert.setType(rule.type());
        alert.setEntity(entity);
        alert.setSeverity(rule.severityLadder().severityFor(ratio));
        alert.setTriggerValue(value);
        alert.setThreshold(rule.threshold());
        alert.setWindowStart(window.start());
        alert.setWindowEnd(window.end());
        alert.setMessage(String.format(Locale.ROOT, "%s %s: %s=%.4f %s %.4f",
                rule.type(), entity, rule.metric(), value, rule.operator(), rule.threshold()));
        alert.setCreatedAt(now);
        return Optional.of(alert);
    }

    private Optional<Alert> insertOnce(Alert alert) {
        try {
            if (alertRepository.existsByDedupKey(alert.getDedupKey())) {
                return Optional.empty();
            }
            Alert saved = alertRepository.insert(alert);
            log.info("Alert raised: {} severity={}", saved.getMessage(), saved.getSeverity());
            applicationEventPublisher.publishEvent(new AlertRaisedEvent(saved));
            return Optional.of(saved);
        } catch (DuplicateKeyException e) {
            log.debug("Alert {} already raised", alert.getDedupKey());
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new StorageException("Cannot store alert " + alert.getDedupKey(), e);
        }
    }
}
