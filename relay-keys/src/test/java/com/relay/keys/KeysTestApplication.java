package com.relay.keys;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 只加载密钥模块的测试启动类。
 */
@SpringBootApplication
public class KeysTestApplication {
}
