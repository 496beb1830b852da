package com.relay.common.exception;

/**
 * Key 不存在或已被停用。
 */
public class InvalidKeyException extends KeyRejectedException {

    public InvalidKeyException() {
        super("INVALID_KEY", "Invalid API key");
    }
}
