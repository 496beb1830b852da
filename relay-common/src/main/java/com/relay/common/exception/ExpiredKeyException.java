package com.relay.common.exception;

/**
 * Key 已过有效期（抛出前已将其标记为停用）。
 */
public class ExpiredKeyException extends KeyRejectedException {

    public ExpiredKeyException() {
        super("EXPIRED_KEY", "API key expired");
    }
}
