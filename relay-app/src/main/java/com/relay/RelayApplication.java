package com.relay;

import com.relay.config.SqliteDirectoryPreparer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alice AI Key 中转服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.relay")
@EnableScheduling
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(RelayApplication.class);
        application.addListeners(new SqliteDirectoryPreparer());
        application.run(args);
    }
}
