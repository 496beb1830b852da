package com.relay.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上游 AI 服务配置项。
 */
@Data
@ConfigurationProperties(prefix = "relay.upstream")
public class UpstreamProperties {

    /** Chat Completions 完整地址（必填，环境变量 API_URL） */
    private String url;

    /** 上游 API Key（必填，环境变量 AI_API_KEY） */
    private String apiKey;

    private String model = "openai/gpt-4o-mini";

    private double temperature = 0.7;

    /** 单次调用的总超时时间（秒），包含连接、发送、等待与读取响应 */
    private double timeoutSeconds = 6;

    /** 建立连接的超时时间（秒） */
    private int connectTimeoutSeconds = 10;

    /** 连接池最大空闲连接数 */
    private int maxIdleConnections = 20;

    /** 空闲连接保活时间（分钟） */
    private int keepAliveMinutes = 5;

    /** 随请求发送的 HTTP-Referer，一般为本服务的公网地址 */
    private String referer = "https://usesir-ai.vercel.app";

    /** 随请求发送的 X-Title */
    private String title = "Alice AI API";

    /** 系统提示词所在的 classpath 路径 */
    private String personaResource = "prompts/persona.md";
}
