package com.fieldops.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String TECHNICIAN_LOCATION_UPDATED  = "technician.location.updated";
    public static final String SCHEDULE_COMMITTED           = "schedule.committed";
    public static final String SCHEDULE_ADAPTED             = "schedule.adapted";
    public static final String SCHEDULE_NOTIFICATION        = "schedule.notification.requested";
}
