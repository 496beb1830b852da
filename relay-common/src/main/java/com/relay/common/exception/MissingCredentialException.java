package com.relay.common.exception;

/**
 * 请求未携带 API Key。
 */
public class MissingCredentialException extends KeyRejectedException {

    public MissingCredentialException() {
        super("MISSING_CREDENTIAL", "Missing API key");
    }
}
