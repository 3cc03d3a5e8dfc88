package com.firefly.prdagent.ai;

import reactor.core.publisher.Flux;

/**
 * AI模型统一接口，支持多种AI模型实现（OpenAI兼容、Ollama等）
 */
public interface AIModel {

    /**
     * 获取模型名称
     */
    String getModelName();

    /**
     * 流式调用AI模型
     * <p>
     * 返回增量 DELTA 片段，最后以一个携带用量的 DONE 结束；模型侧报错可以是 ERROR 片段，
     * 也可以是 Flux 的 error 信号，调用方需同时处理两种情况。取消订阅会中断上游请求。
     *
     * @param request 系统提示词 + 有序消息 + 显式上下文标识
     * @return 流式片段
     */
    Flux<LlmChunk> streamGenerate(LlmRequest request);
}
