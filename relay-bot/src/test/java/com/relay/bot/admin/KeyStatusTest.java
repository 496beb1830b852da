package com.relay.bot.admin;

import com.relay.common.dto.AccessKey;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class KeyStatusTest {

    private static final Instant CREATED = Instant.parse("2026-05-01T00:00:00Z");
    private static final Instant EXPIRES = CREATED.plus(Duration.ofDays(7));

    private static AccessKey key(boolean active) {
        return AccessKey.builder()
                .key("k1")
                .name("alice")
                .createdAt(CREATED)
                .expiresAt(EXPIRES)
                .active(active)
                .build();
    }

    @Test
    void activeBeforeExpiry() {
        assertEquals(KeyStatus.ACTIVE, KeyStatus.of(key(true), EXPIRES.minusMillis(1)));
    }

    @Test
    void expiredFromExpiryInstantOn() {
        assertEquals(KeyStatus.EXPIRED, KeyStatus.of(key(true), EXPIRES));
        assertEquals(KeyStatus.EXPIRED, KeyStatus.of(key(true), EXPIRES.plusSeconds(60)));
    }

    @Test
    void inactiveIsRevokedRegardlessOfExpiry() {
        assertEquals(KeyStatus.REVOKED, KeyStatus.of(key(false), CREATED));
        assertEquals(KeyStatus.REVOKED, KeyStatus.of(key(false), EXPIRES.plusSeconds(60)));
    }
}
