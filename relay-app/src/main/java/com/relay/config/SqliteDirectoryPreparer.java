package com.relay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * SQLite 不会自动创建父目录。数据源指向本地 SQLite 文件时，在数据源创建前建好所在目录。
 * <p>
 * schema.sql 初始化对任何存储后端都会打开数据源，所以这里不看 relay.keys.storage-type。
 * 非 SQLite 或内存库的连接串不做任何处理。
 */
@Slf4j
public class SqliteDirectoryPreparer implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        prepare(event.getEnvironment());
    }

    void prepare(Environment environment) {
        Optional<Path> directory = databaseFile(environment.getProperty("spring.datasource.url"))
                .map(Path::toAbsolutePath)
                .map(Path::getParent);
        if (directory.isEmpty()) {
            return;
        }

        try {
            Files.createDirectories(directory.get());
        } catch (IOException e) {
            throw new IllegalStateException("无法创建 SQLite 数据目录: " + directory.get(), e);
        }
        log.debug("SQLite 数据目录: {}", directory.get());
    }

    /**
     * 从 JDBC 连接串中取出 SQLite 数据库文件路径。
     */
    static Optional<Path> databaseFile(String url) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return Optional.empty();
        }
        String file = url.substring(SQLITE_PREFIX.length());
        int query = file.indexOf('?');
        if (query >= 0) {
            if (file.substring(query).contains("mode=memory")) {
                return Optional.empty();
            }
            file = file.substring(0, query);
        }
        if (file.startsWith("file:")) {
            file = file.substring("file:".length());
        }
        if (file.isBlank() || file.equals(":memory:") || file.startsWith(":resource:")) {
            return Optional.empty();
        }
        return Optional.of(Path.of(file));
    }
}
