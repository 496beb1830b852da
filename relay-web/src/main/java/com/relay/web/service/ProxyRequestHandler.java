package com.relay.web.service;

import com.relay.ai.provider.Completion;
import com.relay.ai.provider.UpstreamClient;
import com.relay.common.dto.AccessKey;
import com.relay.common.exception.MissingParametersException;
import com.relay.common.util.KeyTokens;
import com.relay.keys.service.AccessGuard;
import com.relay.web.config.ProxyProperties;
import com.relay.web.dto.ProxyResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 代理请求处理：参数校验、Key 鉴权、转发上游、成功后计数。
 * <p>
 * 只有上游成功返回的请求才计入用量。鉴权、调用与计数之间不加锁，
 * 并发停用可能放过一次已在途的请求。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyRequestHandler {

    private final AccessGuard accessGuard;
    private final UpstreamClient upstreamClient;
    private final ProxyProperties properties;

    public ProxyResponse handle(String apiKey, String prompt) {
        if (isBlank(apiKey) || isBlank(prompt)) {
            throw new MissingParametersException();
        }

        AccessKey key = accessGuard.authorize(apiKey);
        Completion completion = upstreamClient.complete(prompt);
        accessGuard.recordUsage(key.getKey());

        log.info("代理请求完成: name={}, key={}, 耗时 {}s", key.getName(), KeyTokens.mask(key.getKey()),
                completion.getLatencySeconds());

        return ProxyResponse.builder()
                .provider(properties.getProviderName())
                .reply(completion.getReply())
                .latency(completion.getLatencySeconds())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
