package com.relay.bot.command;

import com.relay.ai.provider.Completion;
import com.relay.ai.provider.UpstreamClient;
import com.relay.bot.admin.AdminConsole;
import com.relay.bot.admin.AdminGate;
import com.relay.bot.config.BotProperties;
import com.relay.bot.telegram.TelegramApiException;
import com.relay.bot.telegram.TelegramClient;
import com.relay.common.dto.AccessKey;
import com.relay.common.exception.UpstreamTimeoutException;
import com.relay.keys.config.KeysProperties;
import com.relay.keys.service.KeyManager;
import com.relay.keys.store.InMemoryKeyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BotCommandDispatcherTest {

    private static final long ADMIN = 1234L;
    private static final long STRANGER = 999L;
    private static final long CHAT = 555L;

    @Mock
    private UpstreamClient upstreamClient;

    @Mock
    private TelegramClient telegramClient;

    private InMemoryKeyStore store;
    private BotCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-05-10T12:00:00Z"), ZoneOffset.UTC);
        BotProperties properties = new BotProperties();
        properties.setAdminId(ADMIN);
        properties.setBaseUrl("https://relay.example");

        store = new InMemoryKeyStore();
        KeyManager keyManager = new KeyManager(store, new KeysProperties(), clock);
        AdminGate gate = new AdminGate(properties);
        AdminConsole console = new AdminConsole(gate, keyManager, upstreamClient, properties, clock);
        dispatcher = new BotCommandDispatcher(gate, console, upstreamClient, telegramClient,
                new BotReplies(properties));
    }

    private static String update(long userId, String text) {
        return "{\"update_id\":1,\"message\":{\"message_id\":7,"
                + "\"from\":{\"id\":" + userId + ",\"is_bot\":false,\"first_name\":\"A\"},"
                + "\"chat\":{\"id\":" + CHAT + ",\"type\":\"private\"},"
                + "\"text\":\"" + text + "\"}}";
    }

    private String lastMarkdown() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(telegramClient, atLeastOnce()).sendMarkdown(eq(CHAT), captor.capture());
        List<String> all = captor.getAllValues();
        return all.get(all.size() - 1);
    }

    @Test
    void start_AnsweredForEveryone() {
        dispatcher.handleUpdate(update(STRANGER, "/start"));

        assertTrue(lastMarkdown().startsWith("*🤖 Alice AI*"));
    }

    @Test
    void genkey_CreatesKeyAndRepliesWithExampleLink() {
        dispatcher.handleUpdate(update(ADMIN, "/genkey alice 30"));

        AccessKey key = store.listAll().get(0);
        String reply = lastMarkdown();
        assertEquals("alice", key.getName());
        assertTrue(reply.contains(key.getKey()));
        assertTrue(reply.contains("https://relay.example/ai?apikey=" + key.getKey() + "&prompt=Hello"));
    }

    @Test
    void genkey_WithBotSuffix() {
        dispatcher.handleUpdate(update(ADMIN, "/genkey@AliceBot bob 3"));

        assertEquals("bob", store.listAll().get(0).getName());
    }

    @Test
    void genkey_BadArgumentsShowUsage() {
        dispatcher.handleUpdate(update(ADMIN, "/genkey alice"));
        assertTrue(lastMarkdown().contains("/genkey <name> <days>"));

        dispatcher.handleUpdate(update(ADMIN, "/genkey alice -3"));
        assertTrue(lastMarkdown().contains("/genkey <name> <days>"));

        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void adminCommands_FromStrangerAreIgnoredSilently() {
        dispatcher.handleUpdate(update(STRANGER, "/genkey mallory 30"));
        dispatcher.handleUpdate(update(STRANGER, "/list"));
        dispatcher.handleUpdate(update(STRANGER, "/delkey alice"));

        assertTrue(store.listAll().isEmpty());
        verifyNoInteractions(telegramClient);
    }

    @Test
    void list_EmptyAndPopulated() {
        dispatcher.handleUpdate(update(ADMIN, "/list"));
        assertEquals("*No keys found*", lastMarkdown());

        dispatcher.handleUpdate(update(ADMIN, "/genkey alice 30"));
        dispatcher.handleUpdate(update(ADMIN, "/list"));
        String reply = lastMarkdown();
        assertTrue(reply.contains("`alice`"));
        assertTrue(reply.contains("2026-06-09 12:00 UTC"));
    }

    @Test
    void usage_UnknownKey() {
        dispatcher.handleUpdate(update(ADMIN, "/usage ghost"));

        assertEquals("*Key not found*", lastMarkdown());
    }

    @Test
    void rework_DeactivatesOldKey() {
        dispatcher.handleUpdate(update(ADMIN, "/genkey alice 30"));
        String oldKey = store.listAll().get(0).getKey();

        dispatcher.handleUpdate(update(ADMIN, "/rework alice"));

        assertFalse(store.findByKey(oldKey).orElseThrow().isActive());
        assertEquals(2, store.listAll().size());
        assertTrue(lastMarkdown().startsWith("*♻️ Key Reworked*"));
    }

    @Test
    void delkey_ReportsCount() {
        dispatcher.handleUpdate(update(ADMIN, "/genkey alice 30"));
        dispatcher.handleUpdate(update(ADMIN, "/delkey alice"));

        assertTrue(lastMarkdown().contains("`1`"));
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void test_UpstreamTimeoutReported() {
        when(upstreamClient.complete(anyString()))
                .thenThrow(new UpstreamTimeoutException("timeout", new SocketTimeoutException()));

        dispatcher.handleUpdate(update(ADMIN, "/test"));

        assertTrue(lastMarkdown().startsWith("*❌ Upstream error*"));
    }

    @Test
    void plainText_IsForwardedToUpstream() {
        when(upstreamClient.complete("hello there"))
                .thenReturn(Completion.builder().reply("Hi! I'm Alice.").latencySeconds(0.8).build());

        dispatcher.handleUpdate(update(STRANGER, "hello there"));

        verify(telegramClient).sendText(CHAT, "Hi! I'm Alice.");
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void plainText_UpstreamFailureGetsShortNotice() {
        when(upstreamClient.complete(anyString()))
                .thenThrow(new UpstreamTimeoutException("timeout", new SocketTimeoutException()));

        dispatcher.handleUpdate(update(ADMIN, "hello"));

        verify(telegramClient).sendText(eq(CHAT), contains("unavailable"));
    }

    @Test
    void nonTextAndMalformedUpdates_AreIgnored() {
        dispatcher.handleUpdate("{\"update_id\":2,\"message\":{\"message_id\":1,\"chat\":{\"id\":5}}}");
        dispatcher.handleUpdate("{\"update_id\":3}");
        dispatcher.handleUpdate("not json");

        verifyNoInteractions(telegramClient, upstreamClient);
    }

    @Test
    void telegramFailure_DoesNotEscape() {
        doThrow(new TelegramApiException("down")).when(telegramClient).sendMarkdown(anyLong(), anyString());

        assertDoesNotThrow(() -> dispatcher.handleUpdate(update(STRANGER, "/help")));
    }
}
