package com.marketsync.alerting;

import com.marketsync.domain.Alert;
import com.marketsync.domain.AlertAcknowledgement;
import com.marketsync.domain.AlertAcknowledgementRepository;
import com.marketsync.domain.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Alert reads and consumer acknowledgements. Acknowledging writes to alert_acks; the alert itself never changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertAcknowledgementService {

    private final AlertRepository alertRepository;
    private final AlertAcknowledgementRepository acknowledgementRepository;
    private final Clock clock;

    public List<Alert> recent(String entity, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 500)));
        return entity == null || entity.isBlank()
                ? alertRepository.findAllByOrderByCreatedAtDesc(page)
                : alertRepository.findByEntityOrderByCreatedAtDesc(entity.trim().toUpperCase(Locale.ROOT), page);
    }

    /**
     * First acknowledgement wins; repeating it returns the stored one.
     *
     * @return empty when the alert does not exist
     */
    public Optional<AlertAcknowledgement> acknowledge(String alertId, String acknowledgedBy) {
        if (!alertRepository.existsById(alertId)) {
            return Optional.empty();
        }
        return Optional.of(acknowledgementRepository.findById(alertId).orElseGet(() -> {
            AlertAcknowledgement ack = new AlertAcknowledgement();
            ack.setAlertId(alertId);
            ack.setAcknowledgedBy(acknowledgedBy);
            ack.setAcknowledgedAt(clock.instant());
            log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
            return acknowledgementRepository.save(ack);
        }));
    }

    public Set<String> acknowledgedIds(Collection<String> alertIds) {
        Set<String> ids = new HashSet<>();
        acknowledgementRepository.findAllById(alertIds).forEach(a -> ids.add(a.getAlertId()));
        return ids;
    }
}
