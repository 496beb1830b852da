package com.relay.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GET /ai 的成功响应。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyResponse {

    private String provider;

    private String reply;

    /** 上游耗时（秒） */
    private double latency;
}
