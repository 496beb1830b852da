package com.relay.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.ai.config.UpstreamProperties;
import com.relay.ai.prompt.PersonaPrompt;
import com.relay.common.exception.UpstreamException;
import com.relay.common.exception.UpstreamProtocolException;
import com.relay.common.exception.UpstreamTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * OpenAI 兼容的 Chat Completions 调用实现（OpenRouter 等网关同样适用）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompatibleClient implements UpstreamClient {

    private final OkHttpClient upstreamHttpClient;
    private final UpstreamProperties properties;
    private final PersonaPrompt personaPrompt;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public Completion complete(String prompt) {
        String requestBody = buildRequestBody(prompt);

        Request request = new Request.Builder()
                .url(properties.getUrl())
                .addHeader("Authorization", "Bearer " + properties.getApiKey())
                .addHeader("Content-Type", "application/json")
                .addHeader("HTTP-Referer", properties.getReferer())
                .addHeader("X-Title", properties.getTitle())
                .post(RequestBody.create(requestBody, JSON_MEDIA))
                .build();

        long start = System.nanoTime();
        String body;
        try (Response response = upstreamHttpClient.newCall(request).execute()) {
            body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.error("上游 API 调用失败: {} - {}", response.code(), body);
                throw new UpstreamException("上游 API 返回错误: " + response.code(), response.code(), body);
            }
        } catch (InterruptedIOException e) {
            log.error("上游 API 调用超时 ({}s): {}", properties.getTimeoutSeconds(), e.getMessage());
            throw new UpstreamTimeoutException("上游 API 调用超时", e);
        } catch (IOException e) {
            log.error("上游 API 网络错误: {}", e.getMessage());
            throw new UpstreamException("调用上游 API 时发生网络错误", e);
        }
        double latency = toSeconds(System.nanoTime() - start);

        String reply = extractReply(body);
        log.info("上游响应长度: {} 字符, 耗时: {}s", reply.length(), latency);
        return new Completion(reply, latency);
    }

    /**
     * 构建请求体：固定的系统提示词 + 一条用户消息。
     */
    private String buildRequestBody(String prompt) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("model", properties.getModel());

            ArrayNode messages = root.putArray("messages");

            ObjectNode systemMsg = messages.addObject();
            systemMsg.put("role", "system");
            systemMsg.put("content", personaPrompt.getText());

            ObjectNode userMsg = messages.addObject();
            userMsg.put("role", "user");
            userMsg.put("content", prompt);

            root.put("temperature", properties.getTemperature());

            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("构建请求体失败", e);
        }
    }

    /**
     * 取 choices[0].message.content，结构不符时抛出 {@link UpstreamProtocolException}。
     */
    private String extractReply(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("上游响应不是合法 JSON: {}", body);
            throw new UpstreamProtocolException("上游响应无法解析", e);
        }

        JsonNode content = json.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            log.error("上游响应缺少 choices[0].message.content: {}", body);
            throw new UpstreamProtocolException("上游响应结构不符合预期", body);
        }
        return content.asText();
    }

    static double toSeconds(long elapsedNanos) {
        return BigDecimal.valueOf(elapsedNanos)
                .divide(BigDecimal.valueOf(1_000_000_000L), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
