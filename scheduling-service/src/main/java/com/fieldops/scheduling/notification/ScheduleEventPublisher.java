package com.fieldops.scheduling.notification;

import com.fieldops.shared.events.ScheduleAdaptedEvent;
import com.fieldops.shared.events.ScheduleCommittedEvent;
import com.fieldops.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Domain events about the committed schedule, keyed by tenant so consumers see one tenant's
 * versions in order. Publishing happens after the commit and never undoes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void committed(ScheduleCommittedEvent event) {
        send(KafkaTopics.SCHEDULE_COMMITTED, event.getTenantId(), event);
    }

    public void adapted(ScheduleAdaptedEvent event) {
        send(KafkaTopics.SCHEDULE_ADAPTED, event.getTenantId(), event);
    }

    private void send(String topic, String key, Object event) {
        try {
            kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for tenant {}: {}", topic, key, e.getMessage());
        }
    }
}
