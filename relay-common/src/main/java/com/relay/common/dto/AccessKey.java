package com.relay.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 访问密钥记录，系统唯一的持久化实体。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccessKey {

    /** Key 本身，全局唯一，同时作为调用凭证 */
    private String key;

    /** 归属名称，可重复（轮换后同名会有多条历史记录） */
    private String name;

    private Instant createdAt;

    /** 创建时确定，之后不再修改；轮换会生成新记录 */
    private Instant expiresAt;

    /** 只会从 true 变为 false，不会恢复 */
    @Builder.Default
    private boolean active = true;

    /** 成功代理的调用次数，只增不减 */
    @Builder.Default
    private long usage = 0;

    /**
     * 在给定时刻是否已过期（到达 expiresAt 即视为过期）。
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 在给定时刻能否用于鉴权：未停用且未过期。
     */
    public boolean isUsableAt(Instant now) {
        return active && !isExpiredAt(now);
    }
}
