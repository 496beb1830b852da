package com.relay.common.exception;

/**
 * 密钥存储不可用（连接失败、SQL 错误等）。
 */
public class StoreUnavailableException extends RelayException {

    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
