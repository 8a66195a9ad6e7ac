package com.fieldops.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilTest {

    @Test
    @DisplayName("Identical payloads hash identically; different payloads do not")
    void deterministicFingerprint() {
        String a = HashUtil.sha256Hex("{\"jobs\":[\"j1\"]}");
        String b = HashUtil.sha256Hex("{\"jobs\":[\"j1\"]}");
        String c = HashUtil.sha256Hex("{\"jobs\":[\"j2\"]}");

        assertThat(a).isEqualTo(b).hasSize(64);
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    @DisplayName("Tenant keys embed prefix, tenant and id")
    void tenantKey() {
        assertThat(HashUtil.tenantKey("technician:", "acme", "t-1")).isEqualTo("technician:acme:t-1");
    }
}
