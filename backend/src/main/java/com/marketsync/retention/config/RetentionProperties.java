package com.marketsync.retention.config;

import com.marketsync.common.ConfigurationException;
import com.marketsync.domain.TableClass;
import com.marketsync.retention.RetentionPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * marketsync.retention.*: policies keyed by id, plus the sweep batch size.
 */
@ConfigurationProperties(prefix = "marketsync.retention")
@NoArgsConstructor
@Getter
@Setter
public class RetentionProperties {

    private Map<String, PolicyDefinition> policies = new LinkedHashMap<>();

    /** Documents archived and deleted per round trip. */
    private int batchSize = 500;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class PolicyDefinition {
        private TableClass tableClass;
        private Duration maxAge;
        private String archiveTarget;
        private Extended extendedRetention;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Extended {
        private List<String> entities = new ArrayList<>();
        private Duration maxAge;
    }

    public List<RetentionPolicy> toPolicies() {
        List<RetentionPolicy> result = new ArrayList<>();
        for (Map.Entry<String, PolicyDefinition> e : policies.entrySet()) {
            String id = e.getKey();
            PolicyDefinition d = e.getValue();
            if (d.getTableClass() == null) {
                throw new ConfigurationException("Retention policy " + id + " needs a table-class");
            }
            if (d.getMaxAge() == null || d.getMaxAge().isNegative() || d.getMaxAge().isZero()) {
                throw new ConfigurationException("Retention policy " + id + " needs a positive max-age");
            }
            if (d.getArchiveTarget() == null || d.getArchiveTarget().isBlank()) {
                throw new ConfigurationException("Retention policy " + id + " has no archive-target; rows are never deleted unarchived");
            }
            if (d.getArchiveTarget().equals(d.getTableClass().collection())) {
                throw new ConfigurationException("Retention policy " + id + " archives into its own collection");
            }
            RetentionPolicy.ExtendedRetention extended = null;
            if (d.getExtendedRetention() != null && !d.getExtendedRetention().getEntities().isEmpty()) {
                Extended x = d.getExtendedRetention();
                if (d.getTableClass().entityField() == null) {
                    throw new ConfigurationException("Retention policy " + id + ": " + d.getTableClass() + " has no entity field");
                }
                if (x.getMaxAge() == null || x.getMaxAge().compareTo(d.getMaxAge()) < 0) {
                    throw new ConfigurationException("Retention policy " + id + ": extended max-age must be at least max-age");
                }
                Set<String> entities = new LinkedHashSet<>();
                x.getEntities().forEach(s -> entities.add(s.toUpperCase(Locale.ROOT)));
                extended = new RetentionPolicy.ExtendedRetention(Set.copyOf(entities), x.getMaxAge());
            }
            result.add(new RetentionPolicy(id, d.getTableClass(), d.getMaxAge(), d.getArchiveTarget(), extended));
        }
        return result;
    }
}
