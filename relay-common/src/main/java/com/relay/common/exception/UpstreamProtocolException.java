package com.relay.common.exception;

/**
 * 上游返回成功状态，但响应结构不符合预期（缺少 choices[0].message.content 等）。
 */
public class UpstreamProtocolException extends UpstreamException {

    public UpstreamProtocolException(String message, String detail) {
        super("UPSTREAM_PROTOCOL", message, NO_STATUS, detail, null);
    }

    public UpstreamProtocolException(String message, Throwable cause) {
        super("UPSTREAM_PROTOCOL", message, NO_STATUS, null, cause);
    }
}
