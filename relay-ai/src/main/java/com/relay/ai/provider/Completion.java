package com.relay.ai.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次上游调用的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Completion {

    /** 第一条 choice 的文本内容 */
    private String reply;

    /** 调用耗时（秒），保留两位小数 */
    private double latencySeconds;
}
