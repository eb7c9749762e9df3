package com.marketsync.scheduler.config;

import com.marketsync.domain.BucketGranularity;
import com.marketsync.scheduler.GuardType;
import com.marketsync.scheduler.StageType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw job definitions (marketsync.jobs[]). Validated into {@link com.marketsync.scheduler.Job} by JobDefinitionFactory.
 */
@ConfigurationProperties(prefix = "marketsync")
@NoArgsConstructor
@Getter
@Setter
public class JobProperties {

    private List<JobDefinition> jobs = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class JobDefinition {
        private String id;
        private boolean enabled = true;
        private Duration interval;
        /** Grid anchor. When absent: registration time if start-now, else the epoch (slots aligned to UTC). */
        private Instant startAt;
        private Instant endAt;
        private boolean startNow = true;
        private GuardType guard = GuardType.ALWAYS;
        private List<StageType> stages = new ArrayList<>();
        private List<String> sources = new ArrayList<>();
        private List<String> entities = new ArrayList<>();
        private List<BucketGranularity> granularities = new ArrayList<>();
        /** Empty means every configured rule. */
        private List<String> alertRules = new ArrayList<>();
        private List<String> models = new ArrayList<>();
        private List<String> retentionPolicies = new ArrayList<>();
        private Duration maxRunDuration;
    }
}
