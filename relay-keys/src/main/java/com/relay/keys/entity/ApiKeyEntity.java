package com.relay.keys.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 访问密钥表 —— api_key 唯一，name / active 建索引。
 * <p>
 * 时间字段以 epoch 毫秒存储，避免 SQLite 无原生时间类型带来的转换问题。
 */
@Table("t_ai_apikey")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyEntity {

    @Id
    private Long id;

    private String apiKey;
    private String name;
    private Long createdAt;
    private Long expiresAt;

    /** 列类型为 INTEGER 0/1，由 SqliteConverters 转换 */
    @Builder.Default
    private Boolean active = true;

    @Builder.Default
    private Long usageCount = 0L;
}
