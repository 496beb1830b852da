package com.relay.config;

import com.relay.ai.config.UpstreamProperties;
import com.relay.bot.config.BotProperties;
import com.relay.keys.config.KeysProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class RequiredSettingsValidatorTest {

    private UpstreamProperties upstream;
    private BotProperties bot;
    private KeysProperties keys;
    private RequiredSettingsValidator validator;

    @BeforeEach
    void setUp() {
        upstream = new UpstreamProperties();
        upstream.setUrl("https://upstream.example/v1/chat/completions");
        upstream.setApiKey("sk-test");
        bot = new BotProperties();
        bot.setToken("123:abc");
        keys = new KeysProperties();
        keys.setStorageType("jdbc");
        validator = new RequiredSettingsValidator(upstream, bot, keys);
        ReflectionTestUtils.setField(validator, "datasourceUrl", "jdbc:sqlite:data/neonosint.db");
        ReflectionTestUtils.setField(validator, "redisUrl", "");
    }

    @Test
    void completeSettingsPass() {
        assertDoesNotThrow(() -> validator.run());
    }

    @Test
    void missingUpstreamAndTokenAbort() {
        upstream.setApiKey(" ");
        bot.setToken(null);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.run());
        assertTrue(e.getMessage().contains("AI_API_KEY"));
        assertTrue(e.getMessage().contains("TELEGRAM_TOKEN"));
        assertFalse(e.getMessage().contains(": API_URL"));
    }

    @Test
    void redisBackendRequiresRedisUrl() {
        keys.setStorageType("redis");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.run());
        assertTrue(e.getMessage().contains("REDIS_URL"));

        ReflectionTestUtils.setField(validator, "redisUrl", "redis://cache:6379");
        assertDoesNotThrow(() -> validator.run());
    }

    @Test
    void memoryBackendNeedsNoConnectionString() {
        keys.setStorageType("memory");
        ReflectionTestUtils.setField(validator, "datasourceUrl", "");

        assertDoesNotThrow(() -> validator.run());
    }
}
