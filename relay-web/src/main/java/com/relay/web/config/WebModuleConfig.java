package com.relay.web.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.relay.web")
@EnableConfigurationProperties(ProxyProperties.class)
public class WebModuleConfig {
}
