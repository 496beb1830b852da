package com.relay.bot.telegram;

import com.relay.common.exception.RelayException;

/**
 * 调用 Telegram Bot API 失败。
 */
public class TelegramApiException extends RelayException {

    public TelegramApiException(String message) {
        super("TELEGRAM_ERROR", message);
    }

    public TelegramApiException(String message, Throwable cause) {
        super("TELEGRAM_ERROR", message, cause);
    }
}
