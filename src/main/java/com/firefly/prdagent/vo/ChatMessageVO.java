package com.firefly.prdagent.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.firefly.prdagent.entity.ChatMessage;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessageVO {

    private String id;
    private String sessionId;
    private String groupId;
    private String role;
    private String senderUserId;
    private String content;
    private Long groupSeq;
    private String runId;
    private String replyToMessageId;
    private String answerAsRole;
    private String status;
    private Integer inputTokens;
    private Integer outputTokens;
    private LocalDateTime timestamp;
    private LocalDateTime updatedAt;

    public static ChatMessageVO from(ChatMessage message) {
        return ChatMessageVO.builder()
                .id(message.getId())
                .sessionId(message.getSessionId())
                .groupId(message.getGroupId())
                .role(message.getRole() != null ? message.getRole().name() : null)
                .senderUserId(message.getSenderUserId())
                .content(message.getContent())
                .groupSeq(message.getGroupSeq())
                .runId(message.getRunId())
                .replyToMessageId(message.getReplyToMessageId())
                .answerAsRole(message.getAnswerAsRole() != null ? message.getAnswerAsRole().name() : null)
                .status(message.getStatus() != null ? message.getStatus().name() : null)
                .inputTokens(message.getInputTokens())
                .outputTokens(message.getOutputTokens())
                .timestamp(message.getTimestamp())
                .updatedAt(message.getUpdatedAt())
                .build();
    }
}
