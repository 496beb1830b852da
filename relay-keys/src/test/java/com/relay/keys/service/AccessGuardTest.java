package com.relay.keys.service;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.ExpiredKeyException;
import com.relay.common.exception.InvalidKeyException;
import com.relay.common.exception.MissingCredentialException;
import com.relay.keys.MutableClock;
import com.relay.keys.config.KeysProperties;
import com.relay.keys.store.InMemoryKeyStore;
import com.relay.keys.store.KeyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for AccessGuard.
 */
class AccessGuardTest {

    private static final Instant T0 = Instant.parse("2026-05-10T12:00:00Z");

    private MutableClock clock;
    private KeyStore store;
    private KeyManager keyManager;
    private AccessGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = spy(new InMemoryKeyStore());
        keyManager = new KeyManager(store, new KeysProperties(), clock);
        guard = new AccessGuard(store, clock);
    }

    @Test
    void authorize_MissingKey() {
        assertThrows(MissingCredentialException.class, () -> guard.authorize(null));
        assertThrows(MissingCredentialException.class, () -> guard.authorize(""));
    }

    @Test
    void authorize_UnknownKey() {
        assertThrows(InvalidKeyException.class, () -> guard.authorize("no-such-key"));
    }

    @Test
    void authorize_ValidKey() {
        AccessKey key = keyManager.createKey("alice", 30);

        AccessKey authorized = guard.authorize(key.getKey());

        assertEquals("alice", authorized.getName());
    }

    @Test
    void authorize_ExpiredKeyIsDeactivated() {
        AccessKey key = keyManager.createKey("alice", 1);
        clock.advance(Duration.ofDays(2));

        assertThrows(ExpiredKeyException.class, () -> guard.authorize(key.getKey()));

        assertFalse(store.findByKey(key.getKey()).orElseThrow().isActive());
        verify(store, times(1)).updateActiveFlag(key.getKey(), false);

        // 第二次只是普通的无效 Key，不再重复停用
        assertThrows(InvalidKeyException.class, () -> guard.authorize(key.getKey()));
        verify(store, times(1)).updateActiveFlag(key.getKey(), false);
    }

    @Test
    void authorize_KeyExpiresExactlyAtExpiresAt() {
        AccessKey key = keyManager.createKey("alice", 1);
        clock.advance(Duration.ofDays(1).minusMillis(1));
        assertNotNull(guard.authorize(key.getKey()));

        clock.advance(Duration.ofMillis(1));
        assertThrows(ExpiredKeyException.class, () -> guard.authorize(key.getKey()));
    }

    @Test
    void authorize_RevokedKeys() {
        AccessKey first = keyManager.createKey("alice", 30);
        AccessKey second = keyManager.createKey("alice", 30);

        assertEquals(2, keyManager.revokeByName("alice"));

        assertThrows(InvalidKeyException.class, () -> guard.authorize(first.getKey()));
        assertThrows(InvalidKeyException.class, () -> guard.authorize(second.getKey()));
    }

    @Test
    void authorize_AfterRotation() {
        AccessKey old = keyManager.createKey("alice", 30);

        AccessKey fresh = keyManager.rotate("alice", 30);

        assertThrows(InvalidKeyException.class, () -> guard.authorize(old.getKey()));
        assertEquals(fresh.getKey(), guard.authorize(fresh.getKey()).getKey());
    }

    @Test
    void recordUsage_IncrementsStoreCounter() {
        AccessKey key = keyManager.createKey("alice", 30);

        guard.recordUsage(key.getKey());
        guard.recordUsage(key.getKey());

        assertEquals(2, store.findByKey(key.getKey()).orElseThrow().getUsage());
        verify(store, times(2)).incrementUsage(key.getKey());
    }
}
