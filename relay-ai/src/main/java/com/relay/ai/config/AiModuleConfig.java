package com.relay.ai.config;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 上游调用模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.relay.ai")
@EnableConfigurationProperties(UpstreamProperties.class)
public class AiModuleConfig {

    /**
     * 所有上游请求共享的 HTTP 客户端，callTimeout 限制单次调用的总耗时。
     */
    @Bean
    public OkHttpClient upstreamHttpClient(UpstreamProperties properties) {
        Duration timeout = Duration.ofMillis(Math.round(properties.getTimeoutSeconds() * 1000));
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(properties.getMaxIdleConnections(),
                        properties.getKeepAliveMinutes(), TimeUnit.MINUTES))
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .callTimeout(timeout)
                .readTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }
}
