package com.relay.common.exception;

/**
 * 写入的 Key 已存在。只在密钥签发内部使用，由签发方重新生成后重试。
 */
public class DuplicateKeyException extends RelayException {

    public DuplicateKeyException(String message) {
        super("DUPLICATE_KEY", message);
    }

    public DuplicateKeyException(String message, Throwable cause) {
        super("DUPLICATE_KEY", message, cause);
    }
}
