package com.marketsync.alerting.sink;

import com.marketsync.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingAlertSink implements AlertSink {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void deliver(Alert alert) {
        log.warn("[{}] {} (rule={}, window={}..{})", alert.getSeverity(), alert.getMessage(),
                alert.getRuleId(), alert.getWindowStart(), alert.getWindowEnd());
    }
}
