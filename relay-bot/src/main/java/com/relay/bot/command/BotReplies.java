package com.relay.bot.command;

import com.relay.bot.admin.ConnectivityReport;
import com.relay.bot.config.BotProperties;
import com.relay.common.dto.AccessKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 机器人回复文案（Telegram Markdown）。
 */
@Component
@RequiredArgsConstructor
public class BotReplies {

    /** Telegram 单条消息的最大长度 */
    static final int MAX_MESSAGE_LENGTH = 4096;

    private static final DateTimeFormatter EXPIRY_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private static final String SEPARATOR = "——————————————\n";

    private final BotProperties properties;

    public String start() {
        return "*🤖 Alice AI*\n"
                + "_Created by @UseSir / @OverShade_\n\n"
                + "Private AI API service.\n\n"
                + "Use /help to view commands.";
    }

    public String help() {
        return "*📘 Commands*\n\n"
                + "`/genkey <name> <days>`\n"
                + "`/list`\n"
                + "`/usage <key | name>`\n"
                + "`/rework <name> [days]`\n"
                + "`/delkey <key | name>`\n"
                + "`/test <name | key | main>`";
    }

    public String usageHint(String syntax) {
        return "*Usage:* `" + syntax + "`";
    }

    public String generated(AccessKey key) {
        return "*🔑 API Key Generated*\n\n"
                + "*Name:* `" + key.getName() + "`\n"
                + "*Key:* `" + key.getKey() + "`\n"
                + "*Expires:* " + EXPIRY_FMT.format(key.getExpiresAt()) + "\n\n"
                + "`" + properties.getBaseUrl() + "/ai?apikey=" + key.getKey() + "&prompt=Hello`";
    }

    public String noKeys() {
        return "*No keys found*";
    }

    /**
     * 按记录拼接列表，超过单条消息长度时拆成多条，单条记录不会被拆开。
     */
    public List<String> list(List<AccessKey> keys) {
        List<String> messages = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (AccessKey key : keys) {
            String entry = "*Name:* `" + key.getName() + "`\n"
                    + "*Key:* `" + key.getKey() + "`\n"
                    + "*Usage:* `" + key.getUsage() + "`\n"
                    + "*Active:* `" + (key.isActive() ? "yes" : "no") + "`\n"
                    + "*Expires:* " + EXPIRY_FMT.format(key.getExpiresAt()) + "\n"
                    + SEPARATOR;
            if (current.length() + entry.length() > MAX_MESSAGE_LENGTH && current.length() > 0) {
                messages.add(current.toString());
                current.setLength(0);
            }
            current.append(entry);
        }
        if (current.length() > 0) {
            messages.add(current.toString());
        }
        return messages;
    }

    public String usage(AccessKey key) {
        return "*📊 Usage*\n\n"
                + "*Name:* `" + key.getName() + "`\n"
                + "*Requests:* `" + key.getUsage() + "`";
    }

    public String keyNotFound() {
        return "*Key not found*";
    }

    public String reworked(AccessKey key) {
        return "*♻️ Key Reworked*\n\n"
                + "*New Key:* `" + key.getKey() + "`";
    }

    public String deleted(int count) {
        return "*🗑️ Deleted*\n`" + count + "` record(s)";
    }

    public String testOk(ConnectivityReport report) {
        StringBuilder text = new StringBuilder("*✅ OK*\n");
        if (report.getTarget() != null) {
            text.append("*Target:* `").append(report.getTarget().getName()).append("`\n");
            text.append("*Status:* `").append(report.getTargetStatus().name().toLowerCase(Locale.ROOT)).append("`\n");
        }
        text.append("Latency: `").append(report.getLatencySeconds()).append("s`");
        return text.toString();
    }

    public String testFailed(String errorCode) {
        return "*❌ Upstream error*\n`" + errorCode + "`";
    }

    public String upstreamUnavailable() {
        return "⚠️ Alice is unavailable right now, please try again later.";
    }

    public String emptyReply() {
        return "🤖 …";
    }

    /**
     * 将纯文本按最大长度切分。
     */
    public List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length(); start += MAX_MESSAGE_LENGTH) {
            chunks.add(text.substring(start, Math.min(text.length(), start + MAX_MESSAGE_LENGTH)));
        }
        return chunks;
    }
}
