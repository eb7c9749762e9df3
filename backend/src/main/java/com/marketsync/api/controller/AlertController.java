package com.marketsync.api.controller;

import com.marketsync.alerting.AlertAcknowledgementService;
import com.marketsync.api.dto.AcknowledgeRequest;
import com.marketsync.api.dto.AcknowledgeResponse;
import com.marketsync.api.dto.AlertResponse;
import com.marketsync.api.dto.ErrorBody;
import com.marketsync.domain.Alert;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * GET /alerts?entity=, POST /alerts/{id}/ack.
 */
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertAcknowledgementService alertAcknowledgementService;

    @GetMapping
    public List<AlertResponse> alerts(@RequestParam(required = false) String entity,
                                      @RequestParam(defaultValue = "100") int limit) {
        List<Alert> alerts = alertAcknowledgementService.recent(entity, limit);
        Set<String> acknowledged = alertAcknowledgementService.acknowledgedIds(alerts.stream().map(Alert::getId).toList());
        return alerts.stream().map(a -> AlertResponse.from(a, acknowledged.contains(a.getId()))).toList();
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<?> acknowledge(@PathVariable String id, @Valid @RequestBody AcknowledgeRequest request) {
        return alertAcknowledgementService.acknowledge(id, request.acknowledgedBy().trim())
                .<ResponseEntity<?>>map(ack -> ResponseEntity.ok(
                        new AcknowledgeResponse(ack.getAlertId(), ack.getAcknowledgedBy(), ack.getAcknowledgedAt())))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("ALERT_NOT_FOUND", "No alert " + id)));
    }
}
