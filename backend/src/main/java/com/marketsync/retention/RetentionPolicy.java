package com.marketsync.retention;

import com.marketsync.domain.TableClass;

import java.time.Duration;
import java.util.Set;

/**
 * Age-based archival rule for one collection. {@code extendedRetention} keeps the listed entities longer
 * (null when the policy treats every entity alike).
 */
public record RetentionPolicy(
        String id,
        TableClass tableClass,
        Duration maxAge,
        String archiveTarget,
        ExtendedRetention extendedRetention
) {

    public record ExtendedRetention(Set<String> entities, Duration maxAge) {
    }
}
