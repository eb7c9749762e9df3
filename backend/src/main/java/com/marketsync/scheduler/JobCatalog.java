package com.marketsync.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jobs known to this instance, in configuration order.
 */
public class JobCatalog {

    private final Map<String, Job> jobs;

    public JobCatalog(List<Job> jobs) {
        Map<String, Job> byId = new LinkedHashMap<>();
        jobs.forEach(j -> byId.put(j.id(), j));
        this.jobs = Collections.unmodifiableMap(byId);
    }

    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<Job> all() {
        return List.copyOf(jobs.values());
    }
}
