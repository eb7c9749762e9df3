package com.marketsync.alerting;

import com.marketsync.alerting.sink.AlertSink;
import com.marketsync.config.AsyncConfig;
import com.marketsync.domain.AlertRaisedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans raised alerts out to every sink on notify-executor. One failing sink does not stop the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertNotificationListener {

    private final List<AlertSink> sinks;

    @EventListener
    @Async(AsyncConfig.NOTIFY_EXECUTOR)
    public void onAlertRaised(AlertRaisedEvent event) {
        for (AlertSink sink : sinks) {
            try {
                sink.deliver(event.alert());
            } catch (RuntimeException e) {
                log.warn("Sink {} failed for alert {}: {}", sink.name(), event.alert().getId(), e.getMessage(), e);
            }
        }
    }
}
