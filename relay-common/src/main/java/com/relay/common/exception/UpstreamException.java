package com.relay.common.exception;

/**
 * 上游 AI 服务调用失败（非 2xx、网络错误等）。
 * <p>
 * {@link #getStatusCode()} 为上游返回的 HTTP 状态码，未拿到响应时为 -1；
 * {@link #getDetail()} 为上游返回的原始错误内容，只记日志，不返回给调用方。
 */
public class UpstreamException extends RelayException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String detail;

    public UpstreamException(String message, int statusCode, String detail) {
        this("UPSTREAM_ERROR", message, statusCode, detail, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this("UPSTREAM_ERROR", message, NO_STATUS, null, cause);
    }

    protected UpstreamException(String errorCode, String message, int statusCode,
                                String detail, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }
}
