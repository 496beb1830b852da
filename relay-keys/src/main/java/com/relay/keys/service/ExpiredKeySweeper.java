package com.relay.keys.service;

import com.relay.keys.store.KeyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * 定时任务：停用已过期但一直没有再被使用的 Key。
 * <p>
 * 默认关闭（{@code relay.keys.sweep-enabled}），鉴权时的过期检查不依赖它。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.keys.sweep-enabled", havingValue = "true")
public class ExpiredKeySweeper {

    private final KeyStore keyStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${relay.keys.sweep-interval-seconds:3600}", timeUnit = TimeUnit.SECONDS)
    public void sweep() {
        int deactivated = keyStore.deactivateExpired(clock.instant());
        if (deactivated > 0) {
            log.info("定时清理停用了 {} 个过期 Key", deactivated);
        }
    }
}
