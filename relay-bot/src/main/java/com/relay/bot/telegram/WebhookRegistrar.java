package com.relay.bot.telegram;

import com.relay.bot.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 启动时将 {baseUrl}/telegram 注册为 Webhook（relay.bot.register-webhook=true 时启用）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.bot.register-webhook", havingValue = "true")
public class WebhookRegistrar implements ApplicationRunner {

    private final TelegramClient telegramClient;
    private final BotProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String url = properties.getBaseUrl() + "/telegram";
        try {
            telegramClient.setWebhook(url);
        } catch (TelegramApiException e) {
            log.error("注册 Telegram Webhook 失败，机器人将收不到消息: {}", e.getMessage());
        }
    }
}
