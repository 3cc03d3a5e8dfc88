package com.firefly.prdagent.entity;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话消息（单条发言）。
 * <p>
 * groupSeq 是群内唯一可信的排序依据，只由群序号服务分配一次；
 * 助手消息的 timestamp 取首个 token 的时间，而不是生成完成的时间。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

    private String id;

    private String sessionId;

    /**
     * 1:1 会话为空
     */
    private String groupId;

    private MessageRole role;

    private String senderUserId;

    private String content;

    private Long groupSeq;

    private String runId;

    private String replyToMessageId;

    private AnswerRole answerAsRole;

    @Builder.Default
    private MessageStatus status = MessageStatus.COMPLETED;

    private Integer inputTokens;

    private Integer outputTokens;

    private LocalDateTime timestamp;

    private LocalDateTime updatedAt;

    public boolean isGroupMessage() {
        return groupId != null && !groupId.isBlank();
    }

    public int contentLength() {
        return content != null ? content.length() : 0;
    }
}
