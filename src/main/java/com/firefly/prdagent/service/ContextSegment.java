package com.firefly.prdagent.service;

import com.firefly.prdagent.ai.LlmMessage;

/**
 * 模型输入中的一段上下文，按类型有序排列：文档 → 压缩摘要 → 历史 → 本轮提问
 */
public record ContextSegment(Kind kind, LlmMessage.Role role, String content) {

    public enum Kind {
        DOCUMENT,
        COMPRESSED_SUMMARY,
        HISTORY,
        NEW_TURN
    }

    public LlmMessage toMessage() {
        return new LlmMessage(role, content);
    }
}
