package com.firefly.prdagent.service;

import com.firefly.prdagent.ai.LlmMessage;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.entity.AnswerRole;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.entity.MessageRole;
import com.firefly.prdagent.entity.PrdDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PromptAssemblerTest {

    private final PromptAssembler assembler = new PromptAssembler();

    private final PrdDocument document = PrdDocument.builder().id("doc-1").title("报表导出").rawContent("# 报表导出\n正文").build();

    @Test
    void shouldOrderDocumentSummaryHistoryThenNewTurn() {
        GroupCompressionState checkpoint = GroupCompressionState.builder().groupId("g1").fromSeq(1L).toSeq(4L).compressedText("早期结论").build();
        List<ChatMessage> history = List.of(
                message(4L, MessageRole.USER, "u2", "已被摘要覆盖"),
                message(5L, MessageRole.USER, "u2", "导出需要审批吗？"),
                message(6L, MessageRole.ASSISTANT, null, "不需要审批。"));

        List<ContextSegment> segments = assembler.segments(groupContext(AnswerRole.DEV), document, Optional.of(checkpoint),
                history, "上限是多少？");

        assertThat(segments).extracting(ContextSegment::kind).containsExactly(
                ContextSegment.Kind.DOCUMENT,
                ContextSegment.Kind.COMPRESSED_SUMMARY,
                ContextSegment.Kind.HISTORY,
                ContextSegment.Kind.HISTORY,
                ContextSegment.Kind.NEW_TURN);
        assertThat(segments.get(0).content()).startsWith(PromptAssembler.DOCUMENT_LABEL).contains("《报表导出》").endsWith("正文");
        assertThat(segments.get(1).content()).startsWith(PromptAssembler.SUMMARY_LABEL).endsWith("早期结论");
        assertThat(segments.get(2).content()).isEqualTo("[u2] 导出需要审批吗？");
        assertThat(segments.get(3).role()).isEqualTo(LlmMessage.Role.ASSISTANT);
        assertThat(segments.get(4).content()).isEqualTo("[u1] 上限是多少？");
    }

    @Test
    void shouldNotPrefixSpeakersInDirectSession() {
        ChatTurnContext context = new ChatTurnContext("run-1", "s1", null, "u1", "doc-1", AnswerRole.PM);
        List<ChatMessage> history = List.of(message(null, MessageRole.USER, "u1", "之前的问题"));

        List<ContextSegment> segments = assembler.segments(context, document, Optional.empty(), history, "新问题");

        assertThat(segments).extracting(ContextSegment::kind).containsExactly(
                ContextSegment.Kind.DOCUMENT, ContextSegment.Kind.HISTORY, ContextSegment.Kind.NEW_TURN);
        assertThat(segments.get(1).content()).isEqualTo("之前的问题");
        assertThat(segments.get(2).content()).isEqualTo("新问题");
    }

    @Test
    void assembleShouldCarryContextIdentifiersAndRoleDirective() {
        LlmRequest request = assembler.assemble(groupContext(AnswerRole.QA), document, Optional.empty(), List.of(), "怎么测？");

        assertThat(request.getRunId()).isEqualTo("run-1");
        assertThat(request.getGroupId()).isEqualTo("g1");
        assertThat(request.getSessionId()).isEqualTo("s1");
        assertThat(request.getPurpose()).isEqualTo(LlmRequest.LlmPurpose.CHAT);
        assertThat(request.getSystemPrompt()).contains("测试工程师");
        assertThat(request.getMessages()).hasSize(2);
    }

    @Test
    void roleDirectiveShouldDefaultToProductManager() {
        assertThat(PromptAssembler.roleDirective(null)).isEqualTo(PromptAssembler.roleDirective(AnswerRole.PM));
    }

    private static ChatTurnContext groupContext(AnswerRole role) {
        return new ChatTurnContext("run-1", "s1", "g1", "u1", "doc-1", role);
    }

    private static ChatMessage message(Long seq, MessageRole role, String sender, String content) {
        return ChatMessage.builder()
                .id("m" + seq)
                .groupSeq(seq)
                .role(role)
                .senderUserId(sender)
                .content(content)
                .build();
    }
}
