package com.relay.web.controller;

import com.relay.web.dto.ProxyResponse;
import com.relay.web.service.ProxyRequestHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 对外的 AI 代理接口。
 */
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private final ProxyRequestHandler requestHandler;

    /**
     * GET /ai?apikey=...&prompt=...
     */
    @GetMapping("/ai")
    public ProxyResponse ask(@RequestParam(value = "apikey", required = false) String apiKey,
                             @RequestParam(value = "prompt", required = false) String prompt) {
        return requestHandler.handle(apiKey, prompt);
    }
}
