package com.relay.bot.admin;

import com.relay.bot.config.BotProperties;
import com.relay.common.exception.AdminAccessDeniedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 管理员身份校验，所有管理操作统一经过这里。
 */
@Component
@RequiredArgsConstructor
public class AdminGate {

    private final BotProperties properties;

    public boolean isAdmin(long userId) {
        return properties.getAdminId() != 0 && properties.getAdminId() == userId;
    }

    /**
     * @throws AdminAccessDeniedException 调用者不是管理员
     */
    public void requireAdmin(long userId) {
        if (!isAdmin(userId)) {
            throw new AdminAccessDeniedException(userId);
        }
    }
}
