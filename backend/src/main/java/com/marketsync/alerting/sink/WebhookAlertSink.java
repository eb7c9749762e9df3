package com.marketsync.alerting.sink;

import com.marketsync.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs each alert as JSON to a configured URL. Fire-and-forget: the response is not awaited.
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private final String url;
    private final WebClient webClient;

    public WebhookAlertSink(String url, WebClient.Builder webClientBuilder) {
        this.url = url;
        this.webClient = webClientBuilder.build();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void deliver(Alert alert) {
        webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload(alert))
                .retrieve()
                .toBodilessEntity()
                .subscribe(
                        ok -> log.debug("Webhook accepted alert {}", alert.getId()),
                        err -> log.warn("Webhook delivery of alert {} failed: {}", alert.getId(), err.getMessage()));
    }

    static Map<String, Object> payload(Alert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", alert.getId());
        body.put("type", alert.getType());
        body.put("entity", alert.getEntity());
        body.put("severity", alert.getSeverity());
        body.put("triggerValue", alert.getTriggerValue());
        body.put("threshold", alert.getThreshold());
        body.put("windowStart", String.valueOf(alert.getWindowStart()));
        body.put("message", alert.getMessage());
        body.put("createdAt", String.valueOf(alert.getCreatedAt()));
        return body;
    }
}
