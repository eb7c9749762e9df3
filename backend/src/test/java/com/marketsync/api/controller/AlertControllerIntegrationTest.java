package com.marketsync.api.controller;

import com.marketsync.domain.AlertAcknowledgementRepository;
import com.marketsync.domain.Alert;
import com.marketsync.domain.AlertRepository;
import com.marketsync.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class AlertControllerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    AlertRepository alertRepository;
    @Autowired
    AlertAcknowledgementRepository acknowledgementRepository;

    @BeforeEach
    void seed() {
        acknowledgementRepository.deleteAll();
        alertRepository.deleteAll();
        alertRepository.saveAll(List.of(
                alert("a-btc-1", "BTC", "2025-03-01T10:00:00Z"),
                alert("a-btc-2", "BTC", "2025-03-01T11:00:00Z"),
                alert("a-eth-1", "ETH", "2025-03-01T10:30:00Z")));
    }

    @Test
    @DisplayName("alerts are filtered by entity, newest first")
    void listsByEntity() {
        webTestClient.get()
                .uri("/api/v1/alerts?entity=btc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo("a-btc-2")
                .jsonPath("$[0].severity").isEqualTo("HIGH")
                .jsonPath("$[0].acknowledged").isEqualTo(false);
    }

    @Test
    @DisplayName("acknowledging marks the alert acknowledged; the first acknowledger is kept")
    void acknowledge() {
        webTestClient.post()
                .uri("/api/v1/alerts/a-eth-1/ack")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"acknowledgedBy\":\" ops-oncall \"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alertId").isEqualTo("a-eth-1")
                .jsonPath("$.acknowledgedBy").isEqualTo("ops-oncall");

        webTestClient.post()
                .uri("/api/v1/alerts/a-eth-1/ack")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"acknowledgedBy\":\"someone-else\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.acknowledgedBy").isEqualTo("ops-oncall");

        webTestClient.get()
                .uri("/api/v1/alerts?entity=ETH")
                .exchange()
                .expectBody()
                .jsonPath("$[0].acknowledged").isEqualTo(true);
    }

    @Test
    void acknowledge_unknownAlert_404() {
        webTestClient.post()
                .uri("/api/v1/alerts/missing/ack")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"acknowledgedBy\":\"ops\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ALERT_NOT_FOUND");
    }

    @Test
    void acknowledge_blankAcknowledger_400() {
        webTestClient.post()
                .uri("/api/v1/alerts/a-eth-1/ack")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"acknowledgedBy\":\"  \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ACKNOWLEDGER");
    }

    private static Alert alert(String id, String entity, String createdAt) {
        Alert a = new Alert();
        a.setId(id);
        a.setDedupKey(id);
        a.setRuleId("price-move-hourly");
        a.setType("PRICE_MOVEMENT");
        a.setEntity(entity);
        a.setSeverity(Severity.HIGH);
        a.setTriggerValue(-11.0);
        a.setThreshold(5.0);
        a.setWindowStart(Instant.parse(createdAt).minusSeconds(3600));
        a.setWindowEnd(Instant.parse(createdAt));
        a.setMessage(entity + " moved -11.00% in the hour");
        a.setCreatedAt(Instant.parse(createdAt));
        return a;
    }
}
