package com.fieldops.scheduling.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fieldops.shared.util.HashUtil;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * SHA-256 of the canonical JSON form of a run's input. Properties and map keys are sorted so the
 * same input always gives the same fingerprint.
 */
@Component
public class InputFingerprint {

    private final ObjectMapper canonical;

    public InputFingerprint() {
        this.canonical = JsonMapper.builder()
                .findAndAddModules()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public String of(Object... parts) {
        try {
            return HashUtil.sha256Hex(canonical.writeValueAsString(Arrays.asList(parts)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Run input is not serializable", e);
        }
    }
}
