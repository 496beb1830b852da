package com.relay.config;

import com.relay.ai.config.UpstreamProperties;
import com.relay.bot.config.BotProperties;
import com.relay.keys.config.KeysProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 启动时检查必填配置，缺任何一项都中止启动。
 * <p>
 * 必填项：上游地址 API_URL、上游凭证 AI_API_KEY、机器人 TELEGRAM_TOKEN，
 * 以及所选存储后端的连接串（jdbc 为 STORE_URI，redis 为 REDIS_URL）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequiredSettingsValidator implements CommandLineRunner {

    private final UpstreamProperties upstreamProperties;
    private final BotProperties botProperties;
    private final KeysProperties keysProperties;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @Value("${REDIS_URL:}")
    private String redisUrl;

    @Override
    public void run(String... args) {
        List<String> missing = new ArrayList<>();
        if (isBlank(upstreamProperties.getUrl())) {
            missing.add("API_URL");
        }
        if (isBlank(upstreamProperties.getApiKey())) {
            missing.add("AI_API_KEY");
        }
        if (isBlank(botProperties.getToken())) {
            missing.add("TELEGRAM_TOKEN");
        }

        String storageType = keysProperties.getStorageType();
        if ("jdbc".equals(storageType) && isBlank(datasourceUrl)) {
            missing.add("STORE_URI");
        } else if ("redis".equals(storageType) && isBlank(redisUrl)) {
            missing.add("REDIS_URL");
        }

        if (!missing.isEmpty()) {
            log.error("==============================================");
            log.error("  缺少必填配置: {}", String.join(", ", missing));
            log.error("  请通过环境变量设置后重新启动");
            log.error("==============================================");
            throw new IllegalStateException("缺少必填配置: " + String.join(", ", missing));
        }

        if (botProperties.getAdminId() == 0) {
            log.warn("未配置 ADMIN_ID，管理命令将全部被忽略");
        }
        log.info("配置检查通过: 存储={}, 上游={}", storageType, upstreamProperties.getUrl());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
