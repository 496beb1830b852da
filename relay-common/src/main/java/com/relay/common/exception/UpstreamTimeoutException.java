package com.relay.common.exception;

/**
 * 上游调用超过配置的超时时间。
 */
public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super("UPSTREAM_TIMEOUT", message, NO_STATUS, null, cause);
    }
}
