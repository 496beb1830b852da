package com.relay.bot.command;

import com.relay.bot.config.BotProperties;
import com.relay.common.dto.AccessKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BotRepliesTest {

    private final BotReplies replies = new BotReplies(new BotProperties());

    @Test
    void list_SplitsLongListingsOnRecordBoundaries() {
        List<AccessKey> keys = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            keys.add(AccessKey.builder()
                    .key("k".repeat(32))
                    .name("name-" + i)
                    .createdAt(Instant.EPOCH)
                    .expiresAt(Instant.parse("2026-01-01T00:00:00Z"))
                    .build());
        }

        List<String> messages = replies.list(keys);

        assertTrue(messages.size() > 1);
        int entries = 0;
        for (String message : messages) {
            assertTrue(message.length() <= BotReplies.MAX_MESSAGE_LENGTH);
            assertTrue(message.endsWith("——————————————\n"));
            entries += message.split("\\*Name:\\*", -1).length - 1;
        }
        assertEquals(100, entries);
    }

    @Test
    void chunk_SplitsAtMaxLength() {
        String text = "a".repeat(BotReplies.MAX_MESSAGE_LENGTH * 2 + 10);

        List<String> chunks = replies.chunk(text);

        assertEquals(3, chunks.size());
        assertEquals(10, chunks.get(2).length());
        assertEquals(text, String.join("", chunks));
    }
}
