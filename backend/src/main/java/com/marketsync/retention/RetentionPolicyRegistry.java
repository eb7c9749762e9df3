package com.marketsync.retention;

import com.marketsync.common.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RetentionPolicyRegistry {

    private final Map<String, RetentionPolicy> policies;

    public RetentionPolicyRegistry(Collection<RetentionPolicy> policies) {
        Map<String, RetentionPolicy> byId = new LinkedHashMap<>();
        for (RetentionPolicy p : policies) {
            if (byId.putIfAbsent(p.id(), p) != null) {
                throw new ConfigurationException("Duplicate retention policy " + p.id());
            }
        }
        this.policies = Collections.unmodifiableMap(byId);
    }

    public RetentionPolicy get(String id) {
        RetentionPolicy p = policies.get(id);
        if (p == null) {
            throw new ConfigurationException("Unknown retention policy " + id);
        }
        return p;
    }

    public boolean contains(String id) {
        return policies.containsKey(id);
    }
}
