package com.fieldops.scheduling.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DisruptionEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("An explicit null severity reads as MEDIUM with its default delay")
    void nullSeverityReadsAsMedium() throws Exception {
        DisruptionEvent event = objectMapper.readValue(
                "{\"type\":\"TRAFFIC_DELAY\",\"severity\":null,\"affectedJobIds\":[\"job-a\"]}",
                DisruptionEvent.class);

        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.isHighPriority()).isFalse();
        assertThat(event.effectiveDelay()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("An omitted severity defaults to MEDIUM and an emergency insertion is always high priority")
    void defaultsAndPriority() throws Exception {
        DisruptionEvent event = objectMapper.readValue("{\"type\":\"EMERGENCY_INSERTION\"}", DisruptionEvent.class);

        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.isHighPriority()).isTrue();
        assertThat(DisruptionEvent.builder().type(DisruptionType.WEATHER).severity(Severity.CRITICAL).build()
                .effectiveDelay()).isEqualTo(Duration.ofMinutes(120));
    }
}
