package com.fieldops.scheduling.location;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.TechnicianStatus;
import com.fieldops.shared.events.TechnicianLocationUpdatedEvent;
import com.fieldops.shared.util.HashUtil;
import com.fieldops.shared.util.KafkaTopics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Technician positions as Redis hashes.
 *
 * Key:    technician:{tenantId}:{technicianId}
 * Fields: lat, lng, status, lastSeen (ISO-8601)
 *
 * Every write also publishes a {@link TechnicianLocationUpdatedEvent}.
 */
@Slf4j
public class RedisTechnicianLocationStore implements TechnicianLocationStore {

    static final String KEY_PREFIX = "technician:";

    private final RedisTemplate<String, String> redisTemplate;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Duration ttl;

    public RedisTechnicianLocationStore(RedisTemplate<String, String> redisTemplate,
                                       KafkaTemplate<String, Object> kafkaTemplate,
                                       Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.kafkaTemplate = kafkaTemplate;
        this.ttl = ttl;
    }

    @Override
    public void save(String tenantId, LocationFix fix) {
        String key = HashUtil.tenantKey(KEY_PREFIX, tenantId, fix.getTechnicianId());
        Map<String, String> fields = new HashMap<>();
        fields.put("lat", String.valueOf(fix.getLocation().getLatitude()));
        fields.put("lng", String.valueOf(fix.getLocation().getLongitude()));
        fields.put("status", fix.getStatus().name());
        fields.put("lastSeen", fix.getRecordedAt().toString());
        redisTemplate.opsForHash().putAll(key, fields);
        redisTemplate.expire(key, ttl);

        TechnicianLocationUpdatedEvent event = TechnicianLocationUpdatedEvent.builder()
                .tenantId(tenantId)
                .technicianId(fix.getTechnicianId())
                .latitude(fix.getLocation().getLatitude())
                .longitude(fix.getLocation().getLongitude())
                .status(fix.getStatus().name())
                .timestamp(fix.getRecordedAt())
                .build();
        kafkaTemplate.send(KafkaTopics.TECHNICIAN_LOCATION_UPDATED, fix.getTechnicianId(), event);
        log.debug("Location stored for technician {} tenant {} at ({},{})", fix.getTechnicianId(), tenantId,
                fix.getLocation().getLatitude(), fix.getLocation().getLongitude());
    }

    @Override
    public Map<String, LocationFix> snapshot(String tenantId, Collection<String> technicianIds) {
        Map<String, LocationFix> fixes = new HashMap<>();
        try {
            for (String technicianId : technicianIds) {
                Map<Object, Object> fields = redisTemplate.opsForHash()
                        .entries(HashUtil.tenantKey(KEY_PREFIX, tenantId, technicianId));
                LocationFix fix = parse(technicianId, fields);
                if (fix != null) {
                    fixes.put(technicianId, fix);
                }
            }
        } catch (DataAccessException e) {
            log.warn("Location snapshot unavailable for tenant {}, falling back to home locations: {}",
                    tenantId, e.getMessage());
            return Map.of();
        }
        return fixes;
    }

    private static LocationFix parse(String technicianId, Map<Object, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        try {
            return LocationFix.builder()
                    .technicianId(technicianId)
                    .location(GeoPoint.of(Double.parseDouble(String.valueOf(fields.get("lat"))),
                            Double.parseDouble(String.valueOf(fields.get("lng")))))
                    .status(TechnicianStatus.valueOf(String.valueOf(fields.get("status"))))
                    .recordedAt(Instant.parse(String.valueOf(fields.get("lastSeen"))))
                    .build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Ignoring malformed location hash for technician {}: {}", technicianId, e.getMessage());
            return null;
        }
    }
}
