package com.marketsync.drift;

import com.marketsync.domain.ModelPerformanceMetric;
import com.marketsync.domain.RetrainRequest;
import com.marketsync.domain.RetrainRequest.RetrainStatus;
import com.marketsync.domain.RetrainRequestRepository;
import com.marketsync.domain.RetrainRequestedEvent;
import com.marketsync.domain.Severity;
import com.marketsync.drift.config.DriftProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DriftMonitorTest {

    private static final Instant NOW = Instant.parse("2025-03-02T00:00:00Z");
    private static final String MODEL = "crypto-price-predictor";

    @Mock
    ModelMetricService modelMetricService;
    @Mock
    RetrainRequestRepository retrainRequestRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private final DriftProperties props = new DriftProperties();
    private DriftMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new DriftMonitor(modelMetricService, retrainRequestRepository, props, applicationEventPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ModelPerformanceMetric metric(double accuracy, double drift) {
        ModelPerformanceMetric m = new ModelPerformanceMetric();
        m.setModelId(MODEL);
        m.setAccuracy(accuracy);
        m.setDriftScore(drift);
        return m;
    }

    /** Newest first: latest metric followed by ten baseline metrics at 0.85. */
    private static List<ModelPerformanceMetric> history(double latestAccuracy, double latestDrift) {
        List<ModelPerformanceMetric> metrics = new ArrayList<>();
        metrics.add(metric(latestAccuracy, latestDrift));
        for (int i = 0; i < 10; i++) {
            metrics.add(metric(0.85, 0.02));
        }
        return metrics;
    }

    @Test
    @DisplayName("healthy model raises no request")
    void healthy_noRequest() {
        when(modelMetricService.latest(MODEL, 11)).thenReturn(history(0.84, 0.05));

        assertThat(monitor.check(MODEL)).isEmpty();
        verifyNoInteractions(retrainRequestRepository, applicationEventPublisher);
    }

    @Test
    @DisplayName("accuracy drop beyond the allowed margin requests retraining")
    void accuracyDrop_requestsRetrain() {
        when(modelMetricService.latest(MODEL, 11)).thenReturn(history(0.78, 0.05));
        when(retrainRequestRepository.existsByModelIdAndStatus(MODEL, RetrainStatus.PENDING)).thenReturn(false);
        when(retrainRequestRepository.save(any(RetrainRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        RetrainRequest request = monitor.check(MODEL).orElseThrow();

        assertThat(request.getStatus()).isEqualTo(RetrainStatus.PENDING);
        assertThat(request.getPriority()).isEqualTo(Severity.MEDIUM);
        assertThat(request.getBaselineAccuracy()).isCloseTo(0.85, within(1e-9));
        assertThat(request.getDeficit()).isCloseTo(0.4, within(1e-9));
        assertThat(request.getReason()).contains("below baseline");
        assertThat(request.getRequestedAt()).isEqualTo(NOW);
        verify(applicationEventPublisher).publishEvent(any(RetrainRequestedEvent.class));
    }

    @Test
    @DisplayName("a pending request suppresses a second one")
    void pendingRequest_noDuplicate() {
        when(modelMetricService.latest(MODEL, 11)).thenReturn(history(0.55, 0.3));
        when(retrainRequestRepository.existsByModelIdAndStatus(MODEL, RetrainStatus.PENDING)).thenReturn(true);

        assertThat(monitor.check(MODEL)).isEmpty();
        verify(retrainRequestRepository, never()).save(any());
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    void noMetrics_noRequest() {
        when(modelMetricService.latest(MODEL, 11)).thenReturn(List.of());

        assertThat(monitor.check(MODEL)).isEmpty();
    }

    @Test
    @DisplayName("deficit is the largest threshold-normalized shortfall")
    void assess_largestDeficit() {
        DriftMonitor.Assessment a = DriftMonitor.assess(List.of(metric(0.63, 0.25)), props);

        assertThat(a.breached()).isTrue();
        assertThat(a.baselineAccuracy()).isNull();
        // accuracy: (0.7 - 0.63) / 0.7 = 0.1; drift: (0.25 - 0.1) / 0.1 = 1.5
        assertThat(a.deficit()).isCloseTo(1.5, within(1e-9));
        assertThat(a.reasons()).hasSize(2);
    }

    @Test
    void priority_ladder() {
        assertThat(DriftMonitor.priority(0.5, 0.1)).isEqualTo(Severity.CRITICAL);
        assertThat(DriftMonitor.priority(0.65, 0.1)).isEqualTo(Severity.HIGH);
        assertThat(DriftMonitor.priority(0.75, 0.1)).isEqualTo(Severity.MEDIUM);
        assertThat(DriftMonitor.priority(0.9, 1.2)).isEqualTo(Severity.HIGH);
        assertThat(DriftMonitor.priority(0.9, 0.6)).isEqualTo(Severity.MEDIUM);
        assertThat(DriftMonitor.priority(0.9, 0.2)).isEqualTo(Severity.LOW);
    }
}
