package com.relay.bot.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.bot.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Telegram Bot API 的最小封装：发送消息、注册 Webhook。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramClient {

    private final OkHttpClient telegramHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    /**
     * 发送 Markdown 格式的消息。
     */
    public void sendMarkdown(long chatId, String text) {
        send(chatId, text, "Markdown");
    }

    /**
     * 发送纯文本消息（AI 回复内容不可控，不按 Markdown 解析）。
     */
    public void sendText(long chatId, String text) {
        send(chatId, text, null);
    }

    /**
     * 将 Webhook 地址注册到 Telegram。
     */
    public void setWebhook(String url) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("url", url);
        call("setWebhook", root);
        log.info("已注册 Telegram Webhook: {}", url);
    }

    private void send(long chatId, String text, String parseMode) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("chat_id", chatId);
        root.put("text", text);
        if (parseMode != null) {
            root.put("parse_mode", parseMode);
        }
        call("sendMessage", root);
        log.debug("已发送消息到 chat {}, 长度 {}", chatId, text.length());
    }

    private void call(String method, ObjectNode payload) {
        String url = properties.getApiBaseUrl() + "/bot" + properties.getToken() + "/" + method;

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TelegramApiException("构建请求体失败", e);
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(requestBody, JSON_MEDIA))
                .build();

        try (Response response = telegramHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String body = response.body() != null ? response.body().string() : "";
                log.error("Telegram {} 调用失败: {} - {}", method, response.code(), body);
                throw new TelegramApiException("Telegram API 返回错误: " + response.code());
            }
        } catch (IOException e) {
            throw new TelegramApiException("调用 Telegram API 时发生网络错误", e);
        }
    }
}
