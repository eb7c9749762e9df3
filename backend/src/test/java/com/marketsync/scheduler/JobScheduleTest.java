package com.marketsync.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobScheduleTest {

    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");
    private final JobSchedule schedule = new JobSchedule(Duration.ofMinutes(3), START, START.plus(Duration.ofMinutes(30)));

    @Test
    void latestSlot_beforeStart_null() {
        assertThat(schedule.latestSlotAtOrBefore(START.minusSeconds(1))).isNull();
    }

    @Test
    void latestSlot_alignedToGrid() {
        assertThat(schedule.latestSlotAtOrBefore(START)).isEqualTo(START);
        assertThat(schedule.latestSlotAtOrBefore(START.plus(Duration.ofMinutes(7)))).isEqualTo(START.plus(Duration.ofMinutes(6)));
    }

    @Test
    void latestSlot_cappedAtEnd() {
        assertThat(schedule.latestSlotAtOrBefore(START.plus(Duration.ofDays(1)))).isEqualTo(START.plus(Duration.ofMinutes(30)));
    }

    @Test
    void nextSlot() {
        assertThat(schedule.nextSlotAfter(null)).isEqualTo(START);
        assertThat(schedule.nextSlotAfter(START)).isEqualTo(START.plus(Duration.ofMinutes(3)));
        assertThat(schedule.nextSlotAfter(START.plusSeconds(200))).isEqualTo(START.plus(Duration.ofMinutes(6)));
        assertThat(schedule.nextSlotAfter(START.plus(Duration.ofMinutes(30)))).isNull();
    }
}
