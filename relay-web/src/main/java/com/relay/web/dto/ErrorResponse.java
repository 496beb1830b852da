package com.relay.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 错误响应：{"error": "..."}。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String error;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error);
    }
}
