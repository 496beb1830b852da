package com.relay.bot.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 机器人模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.relay.bot")
@EnableConfigurationProperties(BotProperties.class)
public class BotModuleConfig {

    @Bean
    public OkHttpClient telegramHttpClient(BotProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .build();
    }
}
