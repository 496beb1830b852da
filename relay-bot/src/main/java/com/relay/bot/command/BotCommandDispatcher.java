package com.relay.bot.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.ai.provider.Completion;
import com.relay.ai.provider.UpstreamClient;
import com.relay.bot.admin.AdminConsole;
import com.relay.bot.admin.AdminGate;
import com.relay.bot.admin.ConnectivityReport;
import com.relay.bot.telegram.TelegramClient;
import com.relay.bot.telegram.TelegramMessage;
import com.relay.bot.telegram.TelegramUpdate;
import com.relay.common.dto.AccessKey;
import com.relay.common.exception.AdminAccessDeniedException;
import com.relay.common.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Telegram 消息分发：斜杠命令路由到管理操作，普通文本直接转给上游 AI 对话。
 * <p>
 * 单条 Update 处理中的任何异常都只记录日志，不向 Webhook 调用方抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotCommandDispatcher {

    private static final Set<String> ADMIN_COMMANDS =
            Set.of("genkey", "list", "usage", "rework", "delkey", "test");

    private final AdminGate adminGate;
    private final AdminConsole adminConsole;
    private final UpstreamClient upstreamClient;
    private final TelegramClient telegramClient;
    private final BotReplies replies;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 处理 Webhook 收到的原始 JSON。
     */
    public void handleUpdate(String payload) {
        TelegramUpdate update;
        try {
            update = objectMapper.readValue(payload, TelegramUpdate.class);
        } catch (JsonProcessingException e) {
            log.warn("无法解析 Telegram Update: {}", e.getOriginalMessage());
            return;
        }
        handle(update);
    }

    public void handle(TelegramUpdate update) {
        TelegramMessage message = update.getMessage();
        if (message == null || message.getChat() == null || message.getText() == null) {
            log.debug("跳过非文本 Update: {}", update.getUpdateId());
            return;
        }

        try {
            dispatch(message);
        } catch (AdminAccessDeniedException e) {
            log.warn("忽略非管理员的管理命令: {}", e.getMessage());
        } catch (Exception e) {
            log.error("处理 Telegram Update {} 失败", update.getUpdateId(), e);
        }
    }

    // ======================== 路由 ========================

    private void dispatch(TelegramMessage message) {
        long chatId = message.getChat().getId();
        long userId = message.getFrom() != null ? message.getFrom().getId() : 0;
        String text = message.getText().strip();

        if (!text.startsWith("/")) {
            chat(chatId, text);
            return;
        }

        String[] parts = text.split("\\s+", 2);
        String command = commandName(parts[0]);
        String args = parts.length > 1 ? parts[1].strip() : "";

        if (ADMIN_COMMANDS.contains(command)) {
            adminGate.requireAdmin(userId);
        }

        switch (command) {
            case "start" -> telegramClient.sendMarkdown(chatId, replies.start());
            case "help" -> telegramClient.sendMarkdown(chatId, replies.help());
            case "genkey" -> genkey(chatId, userId, args);
            case "list" -> list(chatId, userId);
            case "usage" -> usage(chatId, userId, args);
            case "rework" -> rework(chatId, userId, args);
            case "delkey" -> delkey(chatId, userId, args);
            case "test" -> test(chatId, userId, args);
            default -> log.debug("忽略未知命令: /{}", command);
        }
    }

    /**
     * "/genkey@AliceBot" -> "genkey"
     */
    private String commandName(String token) {
        String name = token.substring(1);
        int at = name.indexOf('@');
        if (at >= 0) {
            name = name.substring(0, at);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    // ======================== 管理命令 ========================

    private void genkey(long chatId, long userId, String args) {
        String[] p = args.split("\\s+");
        Integer days = p.length == 2 ? parsePositiveInt(p[1]) : null;
        if (p.length != 2 || p[0].isEmpty() || days == null) {
            telegramClient.sendMarkdown(chatId, replies.usageHint("/genkey <name> <days>"));
            return;
        }
        AccessKey key = adminConsole.generate(userId, p[0], days);
        telegramClient.sendMarkdown(chatId, replies.generated(key));
    }

    private void list(long chatId, long userId) {
        List<AccessKey> keys = adminConsole.list(userId);
        if (keys.isEmpty()) {
            telegramClient.sendMarkdown(chatId, replies.noKeys());
            return;
        }
        for (String chunk : replies.list(keys)) {
            telegramClient.sendMarkdown(chatId, chunk);
        }
    }

    private void usage(long chatId, long userId, String args) {
        if (args.isEmpty()) {
            telegramClient.sendMarkdown(chatId, replies.usageHint("/usage <key | name>"));
            return;
        }
        Optional<AccessKey> key = adminConsole.usage(userId, args);
        telegramClient.sendMarkdown(chatId, key.map(replies::usage).orElseGet(replies::keyNotFound));
    }

    private void rework(long chatId, long userId, String args) {
        String[] p = args.split("\\s+");
        Integer days = p.length == 2 ? parsePositiveInt(p[1]) : null;
        if (p[0].isEmpty() || p.length > 2 || (p.length == 2 && days == null)) {
            telegramClient.sendMarkdown(chatId, replies.usageHint("/rework <name> [days]"));
            return;
        }
        AccessKey key = adminConsole.rework(userId, p[0], days);
        telegramClient.sendMarkdown(chatId, replies.reworked(key));
    }

    private void delkey(long chatId, long userId, String args) {
        if (args.isEmpty()) {
            telegramClient.sendMarkdown(chatId, replies.usageHint("/delkey <key | name>"));
            return;
        }
        int deleted = adminConsole.delete(userId, args);
        telegramClient.sendMarkdown(chatId, replies.deleted(deleted));
    }

    private void test(long chatId, long userId, String args) {
        String target = args.isEmpty() ? AdminConsole.MAIN_TARGET : args;
        try {
            Optional<ConnectivityReport> report = adminConsole.test(userId, target);
            telegramClient.sendMarkdown(chatId, report.map(replies::testOk).orElseGet(replies::keyNotFound));
        } catch (UpstreamException e) {
            log.warn("连通性测试失败: {}", e.getMessage());
            telegramClient.sendMarkdown(chatId, replies.testFailed(e.getErrorCode()));
        }
    }

    // ======================== 对话 ========================

    private void chat(long chatId, String text) {
        String reply;
        try {
            Completion completion = upstreamClient.complete(text);
            reply = completion.getReply();
        } catch (UpstreamException e) {
            log.warn("对话转发失败: {}", e.getMessage());
            telegramClient.sendText(chatId, replies.upstreamUnavailable());
            return;
        }

        if (reply.isBlank()) {
            telegramClient.sendText(chatId, replies.emptyReply());
            return;
        }
        for (String chunk : replies.chunk(reply)) {
            telegramClient.sendText(chatId, chunk);
        }
    }

    private Integer parsePositiveInt(String value) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
