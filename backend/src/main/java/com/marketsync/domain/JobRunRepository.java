package com.marketsync.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JobRun history. Used by the scheduler to resume after restart and by the health API.
 */
public interface JobRunRepository extends MongoRepository<JobRun, String> {

    Optional<JobRun> findFirstByJobIdOrderByTickTimeDesc(String jobId);

    Optional<JobRun> findFirstByJobIdOrderByTickTimeAsc(String jobId);

    Optional<JobRun> findFirstByJobIdAndStatusOrderByTickTimeDesc(String jobId, JobRun.JobRunStatus status);

    List<JobRun> findByJobIdOrderByTickTimeDesc(String jobId, Pageable pageable);

    List<JobRun> findByJobIdAndStatusOrderByTickTimeDesc(String jobId, JobRun.JobRunStatus status, Pageable pageable);

    /** Runs left non-terminal by a crash (resume on startup). */
    List<JobRun> findByStatusIn(Set<JobRun.JobRunStatus> statuses);
}
