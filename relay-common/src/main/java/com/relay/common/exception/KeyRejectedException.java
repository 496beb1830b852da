package com.relay.common.exception;

/**
 * 调用方凭证问题导致的拒绝（缺失、无效、过期），对外映射为 401。
 * <p>
 * message 即返回给客户端的简短原因，不包含任何内部细节。
 */
public abstract class KeyRejectedException extends RelayException {

    protected KeyRejectedException(String errorCode, String message) {
        super(errorCode, message);
    }
}
