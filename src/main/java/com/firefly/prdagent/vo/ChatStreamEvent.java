package com.firefly.prdagent.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.firefly.prdagent.citation.DocCitation;
import com.firefly.prdagent.stream.BlockEventType;
import com.firefly.prdagent.stream.BlockKind;
import com.firefly.prdagent.stream.BlockToken;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 推送给提问者的对话流事件
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatStreamEvent {

    Type type;
    /**
     * 助手消息ID
     */
    String messageId;
    String runId;
    String userMessageId;
    Long userSeq;
    String content;
    String blockId;
    BlockKind blockKind;
    String language;
    List<DocCitation> citations;
    TokenUsage tokenUsage;
    String errorCode;
    String errorMessage;
    Instant requestReceivedAt;
    Instant firstTokenAt;
    Instant completedAt;

    public enum Type {
        START("start"),
        BLOCK_START("blockStart"),
        BLOCK_DELTA("blockDelta"),
        BLOCK_END("blockEnd"),
        CITATIONS("citations"),
        ERROR("error"),
        DONE("done");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    public static ChatStreamEvent fromBlock(BlockToken token, String messageId, String runId) {
        Type type;
        if (token.type() == BlockEventType.START) {
            type = Type.BLOCK_START;
        } else if (token.type() == BlockEventType.END) {
            type = Type.BLOCK_END;
        } else {
            type = Type.BLOCK_DELTA;
        }
        return ChatStreamEvent.builder()
                .type(type)
                .messageId(messageId)
                .runId(runId)
                .blockId(token.blockId())
                .blockKind(token.blockKind())
                .content(token.content())
                .language(token.language())
                .build();
    }

    public static ChatStreamEvent error(String runId, String messageId, String errorCode, String errorMessage,
                                        Instant requestReceivedAt) {
        return ChatStreamEvent.builder()
                .type(Type.ERROR)
                .runId(runId)
                .messageId(messageId)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .requestReceivedAt(requestReceivedAt)
                .completedAt(Instant.now())
                .build();
    }
}
