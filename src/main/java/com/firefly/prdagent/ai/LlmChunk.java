package com.firefly.prdagent.ai;

import com.firefly.prdagent.vo.TokenUsage;

/**
 * 流式调用片段：DELTA 增量文本 / DONE 结束与用量 / ERROR 模型侧错误
 */
public record LlmChunk(Type type, String content, TokenUsage usage, String errorMessage) {

    public enum Type {
        DELTA, DONE, ERROR
    }

    public static LlmChunk delta(String content) {
        return new LlmChunk(Type.DELTA, content, null, null);
    }

    public static LlmChunk done(TokenUsage usage) {
        return new LlmChunk(Type.DONE, null, usage, null);
    }

    public static LlmChunk error(String message) {
        return new LlmChunk(Type.ERROR, null, null, message);
    }

    public boolean hasText() {
        return type == Type.DELTA && content != null && !content.isEmpty();
    }
}
