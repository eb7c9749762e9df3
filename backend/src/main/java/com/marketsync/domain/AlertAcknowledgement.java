package com.marketsync.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Consumer acknowledgement of an alert; id equals the alert id so acknowledging twice is idempotent.
 */
@Document(collection = "alert_acks")
@NoArgsConstructor
@Getter
@Setter
public class AlertAcknowledgement {

    @Id
    private String alertId;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
}
