package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One attempt of a job for one tick. Owned by the job runner; terminal once SUCCEEDED, FAILED or SKIPPED.
 * A failed run keeps the tick time and error so operators can see which window needs re-processing.
 */
@Document(collection = "job_runs")
@CompoundIndex(name = "job_tick", def = "{'jobId': 1, 'tickTime': -1}")
@CompoundIndex(name = "job_status_tick", def = "{'jobId': 1, 'status': 1, 'tickTime': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobRun {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String jobId;
    private Instant tickTime;
    private Instant startedAt;
    private Instant endedAt;
    private JobRunStatus status;
    private String error;
    private String skipReason;
    private RunStats stats = new RunStats();

    public enum JobRunStatus {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED,
        SKIPPED;

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED || this == SKIPPED;
        }
    }
}
