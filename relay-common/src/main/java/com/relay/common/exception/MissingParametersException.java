package com.relay.common.exception;

/**
 * 代理请求缺少 apikey 或 prompt 参数。
 */
public class MissingParametersException extends RelayException {

    public MissingParametersException() {
        super("MISSING_PARAMETERS", "Missing parameters");
    }
}
