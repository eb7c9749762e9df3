package com.marketsync.alerting;

import com.marketsync.alerting.sink.AlertSink;
import com.marketsync.domain.Alert;
import com.marketsync.domain.AlertRaisedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertNotificationListenerTest {

    @Test
    void failingSink_doesNotStopOthers() {
        List<Alert> delivered = new ArrayList<>();
        AlertSink failing = new AlertSink() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public void deliver(Alert alert) {
                throw new IllegalStateException("sink down");
            }
        };
        AlertSink recording = new AlertSink() {
            @Override
            public String name() {
                return "recording";
            }

            @Override
            public void deliver(Alert alert) {
                delivered.add(alert);
            }
        };
        Alert alert = new Alert();
        alert.setId("a-1");

        new AlertNotificationListener(List.of(failing, recording)).onAlertRaised(new AlertRaisedEvent(alert));

        assertThat(delivered).containsExactly(alert);
    }
}
