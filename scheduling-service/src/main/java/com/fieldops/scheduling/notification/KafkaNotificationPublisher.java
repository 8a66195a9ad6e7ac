package com.fieldops.scheduling.notification;

import com.fieldops.shared.events.ScheduleNotificationEvent;
import com.fieldops.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes notifications to {@code schedule.notification.requested}, keyed by recipient so one
 * recipient's messages stay ordered. Delivery (push, SMS, email) happens downstream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationPublisher implements NotificationPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public boolean publish(ScheduleNotificationEvent notification) {
        try {
            kafkaTemplate.send(KafkaTopics.SCHEDULE_NOTIFICATION, notification.getRecipientId(), notification)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Notification for {} {} about job {} not delivered: {}",
                                    notification.getRecipientType(), notification.getRecipientId(),
                                    notification.getJobId(), ex.getMessage());
                        }
                    });
            log.debug("Notification queued: {} {} job={}", notification.getRecipientType(),
                    notification.getRecipientId(), notification.getJobId());
            return true;
        } catch (RuntimeException e) {
            log.warn("Notification for {} {} about job {} dropped: {}", notification.getRecipientType(),
                    notification.getRecipientId(), notification.getJobId(), e.getMessage());
            return false;
        }
    }
}
