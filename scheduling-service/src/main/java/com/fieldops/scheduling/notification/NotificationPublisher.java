package com.fieldops.scheduling.notification;

import com.fieldops.shared.events.ScheduleNotificationEvent;

/**
 * Hands schedule-change notifications to the external delivery channel.
 */
public interface NotificationPublisher {

    /**
     * @return true when the notification was handed over; false when it was dropped.
     *         Implementations never throw.
     */
    boolean publish(ScheduleNotificationEvent notification);
}
