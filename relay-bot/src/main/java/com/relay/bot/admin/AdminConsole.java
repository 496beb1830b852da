package com.relay.bot.admin;

import com.relay.ai.provider.Completion;
import com.relay.ai.provider.UpstreamClient;
import com.relay.bot.config.BotProperties;
import com.relay.common.dto.AccessKey;
import com.relay.keys.service.KeyManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * 管理操作入口：每个操作先校验管理员身份，再委托给 {@link KeyManager}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminConsole {

    /** /test 发给上游的探测内容 */
    static final String PING_PROMPT = "OK";

    /** /test 的默认目标，只探测上游 */
    public static final String MAIN_TARGET = "main";

    private final AdminGate adminGate;
    private final KeyManager keyManager;
    private final UpstreamClient upstreamClient;
    private final BotProperties properties;
    private final Clock clock;

    public AccessKey generate(long adminId, String name, int days) {
        adminGate.requireAdmin(adminId);
        return keyManager.createKey(name, days);
    }

    public List<AccessKey> list(long adminId) {
        adminGate.requireAdmin(adminId);
        return keyManager.listAll();
    }

    public Optional<AccessKey> usage(long adminId, String keyOrName) {
        adminGate.requireAdmin(adminId);
        return keyManager.getUsage(keyOrName);
    }

    /**
     * 停用该名称下的所有 Key 并签发新 Key。
     *
     * @param days 为 null 时使用 {@code relay.bot.rework-lifetime-days}
     */
    public AccessKey rework(long adminId, String name, Integer days) {
        adminGate.requireAdmin(adminId);
        int lifetime = days != null ? days : properties.getReworkLifetimeDays();
        return keyManager.rotate(name, lifetime);
    }

    public int delete(long adminId, String keyOrName) {
        adminGate.requireAdmin(adminId);
        return keyManager.deleteByKeyOrName(keyOrName);
    }

    /**
     * 连通性测试。target 为 {@code main} 时只探测上游；否则先确认目标 Key 存在，
     * 再探测上游并附带该 Key 的状态。探测请求不计入任何 Key 的用量。
     *
     * @return 目标 Key 不存在时为空
     */
    public Optional<ConnectivityReport> test(long adminId, String target) {
        adminGate.requireAdmin(adminId);

        AccessKey key = null;
        if (target != null && !target.isBlank() && !MAIN_TARGET.equalsIgnoreCase(target)) {
            Optional<AccessKey> found = keyManager.getUsage(target);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            key = found.get();
        }

        Completion completion = upstreamClient.complete(PING_PROMPT);
        log.info("连通性测试完成: target={}, 耗时 {}s", key != null ? key.getName() : MAIN_TARGET,
                completion.getLatencySeconds());

        return Optional.of(ConnectivityReport.builder()
                .target(key)
                .targetStatus(key != null ? KeyStatus.of(key, clock.instant()) : null)
                .latencySeconds(completion.getLatencySeconds())
                .build());
    }
}
