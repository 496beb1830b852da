package com.relay.ai.provider;

/**
 * 上游 AI 文本补全接口。
 * <p>
 * 每次调用只发一次请求，超时或失败直接抛出
 * {@link com.relay.common.exception.UpstreamException} 及其子类，不做重试。
 */
public interface UpstreamClient {

    /**
     * 以固定的系统提示词 + 单条用户消息调用上游（阻塞式，等待完整响应）。
     *
     * @param prompt 用户输入
     * @return 回复文本与调用耗时
     */
    Completion complete(String prompt);
}
