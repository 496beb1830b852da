package com.relay.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "relay.proxy")
public class ProxyProperties {

    /** 响应中 provider 字段的值 */
    private String providerName = "Alice AI";
}
