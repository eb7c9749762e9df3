package com.marketsync.api.controller;

import com.marketsync.api.dto.JobHealthResponse;
import com.marketsync.api.dto.JobRunResponse;
import com.marketsync.api.dto.TriggerResponse;
import com.marketsync.domain.JobRun.JobRunStatus;
import com.marketsync.scheduler.JobHealthService;
import com.marketsync.scheduler.JobRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /jobs (schedule health), GET /jobs/{id}/runs, POST /jobs/{id}/trigger.
 */
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobHealthService jobHealthService;
    private final JobRunner jobRunner;

    @GetMapping
    public List<JobHealthResponse> jobs() {
        return jobHealthService.all().stream().map(JobHealthResponse::from).toList();
    }

    @GetMapping("/{id}/runs")
    public List<JobRunResponse> runs(@PathVariable String id,
                                     @RequestParam(required = false) JobRunStatus status,
                                     @RequestParam(defaultValue = "50") int limit) {
        return jobHealthService.runs(id, status, limit).stream().map(JobRunResponse::from).toList();
    }

    @PostMapping("/{id}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String id) {
        jobRunner.runNow(id);
        return ResponseEntity.accepted().body(new TriggerResponse(id, "Run triggered"));
    }
}
