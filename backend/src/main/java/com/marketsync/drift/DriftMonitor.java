package com.marketsync.drift;

import com.marketsync.common.KeyedLocks;
import com.marketsync.domain.ModelPerformanceMetric;
import com.marketsync.domain.RetrainRequest;
import com.marketsync.domain.RetrainRequest.RetrainStatus;
import com.marketsync.domain.RetrainRequestRepository;
import com.marketsync.domain.RetrainRequestedEvent;
import com.marketsync.domain.Severity;
import com.marketsync.drift.config.DriftProperties;
import com.marketsync.ingestion.store.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares a model's latest metric with the mean accuracy of the metrics before it and requests retraining when
 * accuracy, drift or the drop from baseline breaches its threshold. At most one PENDING request per model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriftMonitor {

    private final ModelMetricService modelMetricService;
    private final RetrainRequestRepository retrainRequestRepository;
    private final DriftProperties driftProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final KeyedLocks modelLocks = new KeyedLocks();

    /**
     * Breach assessment of the latest metric; deficit is the largest shortfall normalized by its threshold.
     */
    record Assessment(ModelPerformanceMetric latest, Double baselineAccuracy, double deficit, List<String> reasons) {

        boolean breached() {
            return !reasons.isEmpty();
        }
    }

    public Optional<RetrainRequest> check(String modelId) {
        return modelLocks.withLock(modelId, () -> {
            List<ModelPerformanceMetric> metrics = modelMetricService.latest(modelId, driftProperties.getBaselineSize() + 1);
            if (metrics.isEmpty()) {
                return Optional.<RetrainRequest>empty();
            }
            Assessment assessment = assess(metrics, driftProperties);
            if (!assessment.breached()) {
                return Optional.<RetrainRequest>empty();
            }
            try {
                if (retrainRequestRepository.existsByModelIdAndStatus(modelId, RetrainStatus.PENDING)) {
                    log.debug("Model {} breached thresholds but a retrain request is already pending", modelId);
                    return Optional.<RetrainRequest>empty();
                }
                RetrainRequest saved = retrainRequestRepository.save(toRequest(modelId, assessment));
                log.info("Retrain requested for {}: {} (deficit={}, priority={})",
                        modelId, saved.getReason(), saved.getDeficit(), saved.getPriority());
                applicationEventPublisher.publishEvent(new RetrainRequestedEvent(saved));
                return Optional.of(saved);
            } catch (DataAccessException e) {
                throw new StorageException("Cannot store retrain request for " + modelId, e);
            }
        });
    }

    /**
     * @param metrics newest first; element 0 is the latest, the rest the baseline
     */
    static Assessment assess(List<ModelPerformanceMetric> metrics, DriftProperties props) {
        ModelPerformanceMetric latest = metrics.get(0);
        Double baseline = null;
        if (metrics.size() > 1) {
            baseline = metrics.subList(1, metrics.size()).stream()
                    .mapToDouble(ModelPerformanceMetric::getAccuracy)
                    .average()
                    .orElseThrow();
        }
        List<String> reasons = new ArrayList<>();
        double deficit = 0.0;
        double accuracy = latest.getAccuracy();
        if (accuracy < props.getMinAccuracy()) {
            deficit = Math.max(deficit, (props.getMinAccuracy() - accuracy) / props.getMinAccuracy());
            reasons.add(String.format(Locale.ROOT, "accuracy %.3f < %.3f", accuracy, props.getMinAccuracy()));
        }
        if (latest.getDriftScore() > props.getMaxDrift()) {
            deficit = Math.max(deficit, (latest.getDriftScore() - props.getMaxDrift()) / props.getMaxDrift());
            reasons.add(String.format(Locale.ROOT, "drift %.3f > %.3f", latest.getDriftScore(), props.getMaxDrift()));
        }
        if (baseline != null && baseline - accuracy > props.getMaxAccuracyDrop()) {
            double drop = baseline - accuracy;
            deficit = Math.max(deficit, (drop - props.getMaxAccuracyDrop()) / props.getMaxAccuracyDrop());
            reasons.add(String.format(Locale.ROOT, "accuracy dropped %.3f below baseline %.3f", drop, baseline));
        }
        return new Assessment(latest, baseline, deficit, reasons);
    }

    static Severity priority(double accuracy, double deficit) {
        if (accuracy < 0.6) {
            return Severity.CRITICAL;
        }
        if (accuracy < 0.7) {
            return Severity.HIGH;
        }
        if (accuracy < 0.8) {
            return Severity.MEDIUM;
        }
        if (deficit >= 1.0) {
            return Severity.HIGH;
        }
        return deficit >= 0.5 ? Severity.MEDIUM : Severity.LOW;
    }

    private RetrainRequest toRequest(String modelId, Assessment a) {
        RetrainRequest r = new RetrainRequest();
        r.setModelId(modelId);
        r.setReason(String.join("; ", a.reasons()));
        r.setDeficit(a.deficit());
        r.setPriority(priority(a.latest().getAccuracy(), a.deficit()));
        r.setLatestAccuracy(a.latest().getAccuracy());
        r.setBaselineAccuracy(a.baselineAccuracy());
        r.setDriftScore(a.latest().getDriftScore());
        r.setStatus(RetrainStatus.PENDING);
        r.setRequestedAt(clock.instant());
        return r;
    }
}
