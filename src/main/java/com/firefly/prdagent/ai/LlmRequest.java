package com.firefly.prdagent.ai;

import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * 一次模型调用的完整输入。
 * 请求标识（runId / groupId / sessionId）随请求显式传递，用于日志与用量归属，不依赖线程上下文。
 */
@Data
@Builder
public class LlmRequest {

    private String systemPrompt;

    @Singular
    private List<LlmMessage> messages;

    @Builder.Default
    private LlmPurpose purpose = LlmPurpose.CHAT;

    private String runId;
    private String groupId;
    private String sessionId;

    public int totalChars() {
        int total = systemPrompt != null ? systemPrompt.length() : 0;
        for (LlmMessage m : messages) {
            total += m.content() != null ? m.content().length() : 0;
        }
        return total;
    }

    public enum LlmPurpose {
        CHAT, COMPRESSION
    }
}
