package com.relay.web.controller;

import com.relay.common.exception.KeyRejectedException;
import com.relay.common.exception.MissingParametersException;
import com.relay.common.exception.RelayException;
import com.relay.common.exception.StoreUnavailableException;
import com.relay.common.exception.UpstreamException;
import com.relay.common.exception.UpstreamTimeoutException;
import com.relay.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理器。5xx 只返回简短原因，细节写日志。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingParametersException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleMissingParameters(MissingParametersException e) {
        return ErrorResponse.of(e.getMessage());
    }

    @ExceptionHandler(KeyRejectedException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ErrorResponse handleKeyRejected(KeyRejectedException e) {
        return ErrorResponse.of(e.getMessage());
    }

    // 子类在前，Spring 会按最近的异常类型匹配
    @ExceptionHandler(UpstreamTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public ErrorResponse handleUpstreamTimeout(UpstreamTimeoutException e) {
        log.warn("上游超时: {}", e.getMessage());
        return ErrorResponse.of("Upstream timeout");
    }

    @ExceptionHandler(UpstreamException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ErrorResponse handleUpstream(UpstreamException e) {
        log.warn("上游错误: [{}] {} status={} detail={}", e.getErrorCode(), e.getMessage(),
                e.getStatusCode(), e.getDetail());
        return ErrorResponse.of("Upstream error");
    }

    @ExceptionHandler(StoreUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Key 存储不可用", e);
        return ErrorResponse.of("Service unavailable");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNoResourceFound(NoResourceFoundException e) {
        log.debug("资源未找到: {}", e.getResourcePath());
        return ErrorResponse.of("Not found");
    }

    @ExceptionHandler(RelayException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleRelayException(RelayException e) {
        log.error("业务异常: [{}] {}", e.getErrorCode(), e.getMessage(), e);
        return ErrorResponse.of("Internal error");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ErrorResponse.of("Internal error");
    }
}
