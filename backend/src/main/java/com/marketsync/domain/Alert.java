package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Raised alert. Write-once: inserted by AlertEngine and never updated. Acknowledgements live in alert_acks.
 * dedupKey = ruleId|entity|windowStart guarantees one alert per (entity, rule, window).
 */
@Document(collection = "alerts")
@CompoundIndex(name = "entity_created", def = "{'entity': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Alert {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String dedupKey;
    private String ruleId;
    private String type;
    private String entity;
    private Severity severity;
    private double triggerValue;
    private double threshold;
    private Instant windowStart;
    private Instant windowEnd;
    private String message;
    @Indexed
    private Instant createdAt;

    public static String dedupKeyOf(String ruleId, String entity, Instant windowStart) {
        return ruleId + "|" + entity + "|" + windowStart;
    }
}
