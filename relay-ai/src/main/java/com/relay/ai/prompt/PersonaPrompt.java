package com.relay.ai.prompt;

import com.relay.ai.config.UpstreamProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 系统提示词（助手身份设定）。
 * <p>
 * 从 classpath 下的 {@code prompts/persona.md} 加载，修改身份设定只需编辑该文件并重启。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersonaPrompt {

    private final UpstreamProperties properties;

    private String text;

    @PostConstruct
    void load() {
        String path = properties.getPersonaResource();
        ClassPathResource resource = new ClassPathResource(path);
        try {
            text = resource.getContentAsString(StandardCharsets.UTF_8).strip();
            log.info("已加载系统提示词 (classpath:{}, {} 字符)", path, text.length());
        } catch (IOException e) {
            throw new IllegalStateException("无法加载系统提示词: classpath:" + path, e);
        }
    }

    public String getText() {
        return text;
    }
}
