package com.relay.bot.admin;

import com.relay.common.dto.AccessKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * /test 的结果：上游耗时，以及指定目标 Key 时该 Key 的状态。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectivityReport {

    /** 目标 Key，测试 main 时为 null */
    private AccessKey target;

    private KeyStatus targetStatus;

    private double latencySeconds;
}
