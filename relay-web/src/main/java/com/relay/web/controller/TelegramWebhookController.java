package com.relay.web.controller;

import com.relay.bot.command.BotCommandDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram Webhook 入口。处理结果不影响响应，始终返回 200，避免 Telegram 重复推送。
 */
@RestController
@RequiredArgsConstructor
public class TelegramWebhookController {

    private final BotCommandDispatcher dispatcher;

    @PostMapping("/telegram")
    public String webhook(@RequestBody(required = false) String payload) {
        if (payload != null) {
            dispatcher.handleUpdate(payload);
        }
        return "OK";
    }
}
