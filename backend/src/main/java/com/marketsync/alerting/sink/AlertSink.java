package com.marketsync.alerting.sink;

import com.marketsync.domain.Alert;

/**
 * Delivery target for raised alerts. Called off the job worker; failures are logged by the caller and never
 * affect pipeline state.
 */
public interface AlertSink {

    String name();

    void deliver(Alert alert);
}
