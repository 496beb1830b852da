package com.relay.common.exception;

/**
 * 非管理员调用管理操作。
 */
public class AdminAccessDeniedException extends RelayException {

    public AdminAccessDeniedException(long userId) {
        super("NOT_ADMIN", "用户 " + userId + " 不是管理员");
    }
}
