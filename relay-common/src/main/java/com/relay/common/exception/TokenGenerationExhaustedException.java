package com.relay.common.exception;

/**
 * 连续多次生成的 Key 均与已有 Key 冲突。
 */
public class TokenGenerationExhaustedException extends RelayException {

    public TokenGenerationExhaustedException(String message, Throwable cause) {
        super("TOKEN_EXHAUSTED", message, cause);
    }
}
