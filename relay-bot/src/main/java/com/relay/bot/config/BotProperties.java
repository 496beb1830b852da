package com.relay.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Telegram 管理机器人配置项。
 */
@Data
@ConfigurationProperties(prefix = "relay.bot")
public class BotProperties {

    /** Bot Token（必填，环境变量 TELEGRAM_TOKEN） */
    private String token;

    /** 管理员的 Telegram 用户 ID（环境变量 ADMIN_ID），0 表示没有管理员 */
    private long adminId = 0;

    /** 本服务的公网地址（环境变量 BASE_URL），用于拼接示例链接和 Webhook 地址 */
    private String baseUrl = "https://usesir-ai.vercel.app";

    /** Telegram Bot API 地址 */
    private String apiBaseUrl = "https://api.telegram.org";

    /** 启动时是否调用 setWebhook 注册 {baseUrl}/telegram */
    private boolean registerWebhook = false;

    /** /rework 未指定天数时的有效期 */
    private int reworkLifetimeDays = 30;

    /** 发送消息的超时时间（秒） */
    private int requestTimeoutSeconds = 10;
}
