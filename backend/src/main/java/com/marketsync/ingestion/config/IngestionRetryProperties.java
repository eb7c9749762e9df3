package com.marketsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for source fetches within one run (exponential backoff ± jitter).
 * After the last attempt the failure is transient: the run fails and the next tick retries the window.
 */
@ConfigurationProperties(prefix = "marketsync.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Attempts per fetch including the first call. Default 3. */
    private int maxAttempts = 3;
}
