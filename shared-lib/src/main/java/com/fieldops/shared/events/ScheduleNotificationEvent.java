package com.fieldops.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload handed to the external notification dispatcher (push / SMS / email).
 * Delivery is best-effort; the scheduling side never waits for an acknowledgement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleNotificationEvent {

    public static final String TOPIC = "schedule.notification.requested";

    public enum RecipientType { TECHNICIAN, CUSTOMER }

    private String tenantId;
    private RecipientType recipientType;
    private String recipientId;
    private String jobId;
    private String title;
    private String body;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant scheduledStart;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;
}
