package com.marketsync.scheduler;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drives {@link JobScheduler#tick} from the scheduler pool.
 */
@Component
@ConditionalOnProperty(prefix = "marketsync.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SchedulerTickJob {

    private final JobScheduler jobScheduler;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${marketsync.scheduler.tick-interval-ms:1000}")
    public void tick() {
        jobScheduler.tick(clock.instant());
    }
}
