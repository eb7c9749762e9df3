package com.marketsync.api.controller;

import com.marketsync.domain.JobRun;
import com.marketsync.domain.JobRun.JobRunStatus;
import com.marketsync.domain.JobRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

@SpringBootTest(properties = {
        "marketsync.jobs[0].id=model-monitoring",
        "marketsync.jobs[0].interval=1h",
        "marketsync.jobs[0].stages[0]=DRIFT_CHECK",
        "marketsync.jobs[0].models[0]=crypto-price-predictor"
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class JobControllerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    JobRunRepository jobRunRepository;

    @BeforeEach
    void clean() {
        jobRunRepository.deleteAll();
    }

    @Test
    @DisplayName("jobs endpoint lists every configured job with its schedule health")
    void listsJobs() {
        webTestClient.get()
                .uri("/api/v1/jobs")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].jobId").isEqualTo("model-monitoring")
                .jsonPath("$[0].enabled").isEqualTo(true)
                .jsonPath("$[0].interval").isEqualTo("PT1H")
                .jsonPath("$[0].status").exists();
    }

    @Test
    @DisplayName("runs endpoint filters by status, newest first")
    void runsFilteredByStatus() {
        jobRunRepository.saveAll(List.of(
                run(JobRunStatus.FAILED, "2025-03-01T10:00:00Z", "source timeout"),
                run(JobRunStatus.SUCCEEDED, "2025-03-01T11:00:00Z", null),
                run(JobRunStatus.FAILED, "2025-03-01T12:00:00Z", "deadline exceeded")));

        webTestClient.get()
                .uri("/api/v1/jobs/model-monitoring/runs?status=FAILED")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].error").isEqualTo("deadline exceeded")
                .jsonPath("$[1].error").isEqualTo("source timeout");
    }

    @Test
    void runs_unknownJob_404() {
        webTestClient.get()
                .uri("/api/v1/jobs/nope/runs")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void trigger_acceptsKnownJob() {
        webTestClient.post()
                .uri("/api/v1/jobs/model-monitoring/trigger")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("model-monitoring");
    }

    @Test
    void trigger_unknownJob_404() {
        webTestClient.post()
                .uri("/api/v1/jobs/nope/trigger")
                .exchange()
                .expectStatus().isNotFound();
    }

    private static JobRun run(JobRunStatus status, String tick, String error) {
        JobRun r = new JobRun();
        r.setJobId("model-monitoring");
        r.setTickTime(Instant.parse(tick));
        r.setStartedAt(Instant.parse(tick));
        r.setEndedAt(Instant.parse(tick).plusSeconds(5));
        r.setStatus(status);
        r.setError(error);
        return r;
    }
}
