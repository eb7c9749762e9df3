package com.marketsync.scheduler;

import com.marketsync.domain.JobRun;
import com.marketsync.domain.JobRun.JobRunStatus;
import com.marketsync.domain.JobRunRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobRunTrackerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    JobRunRepository jobRunRepository;

    private JobRunTracker tracker() {
        return new JobRunTracker(jobRunRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void failAbandoned_marksPendingAndRunningAsFailed() {
        JobRun pending = new JobRun();
        pending.setStatus(JobRunStatus.PENDING);
        JobRun running = new JobRun();
        running.setStatus(JobRunStatus.RUNNING);
        when(jobRunRepository.findByStatusIn(Set.of(JobRunStatus.PENDING, JobRunStatus.RUNNING)))
                .thenReturn(List.of(pending, running));
        when(jobRunRepository.save(any(JobRun.class))).thenAnswer(inv -> inv.getArgument(0));

        int failed = tracker().failAbandoned();

        assertThat(failed).isEqualTo(2);
        assertThat(List.of(pending, running)).allSatisfy(r -> {
            assertThat(r.getStatus()).isEqualTo(JobRunStatus.FAILED);
            assertThat(r.getError()).isEqualTo("interrupted by restart");
            assertThat(r.getEndedAt()).isEqualTo(NOW);
        });
    }

    @Test
    void failAbandoned_nothingToDo() {
        when(jobRunRepository.findByStatusIn(Set.of(JobRunStatus.PENDING, JobRunStatus.RUNNING))).thenReturn(List.of());

        assertThat(tracker().failAbandoned()).isZero();
        verify(jobRunRepository, never()).save(any());
    }

    @Test
    void recordSkipped_persistsTerminalRun() {
        when(jobRunRepository.save(any(JobRun.class))).thenAnswer(inv -> inv.getArgument(0));

        JobRun run = tracker().recordSkipped("market-data-sync", NOW, "worker pool saturated");

        assertThat(run.getJobId()).isEqualTo("market-data-sync");
        assertThat(run.getStatus()).isEqualTo(JobRunStatus.SKIPPED);
        assertThat(run.getStatus().isTerminal()).isTrue();
        assertThat(run.getSkipReason()).isEqualTo("worker pool saturated");
        assertThat(run.getStartedAt()).isEqualTo(NOW);
    }
}
