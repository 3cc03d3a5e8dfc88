package com.firefly.prdagent.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.firefly.prdagent.citation.DocCitation;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 群订阅流中的增量事件（delta / blockEnd / citations），完整消息直接推送 {@link ChatMessageVO}
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroupStreamEvent {

    public static final String MESSAGE = "message";
    public static final String MESSAGE_UPDATED = "messageUpdated";
    public static final String DELTA = "delta";
    public static final String BLOCK_END = "blockEnd";
    public static final String CITATIONS = "citations";

    String groupId;
    String messageId;
    String content;
    String blockId;
    Boolean isFirst;
    List<DocCitation> citations;
}
