package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.ai.AIModel;
import com.firefly.prdagent.ai.AIModelFactory;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.citation.DocCitationExtractor;
import com.firefly.prdagent.compression.GroupContextService;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.dto.SendMessageRequest;
import com.firefly.prdagent.entity.ChatSession;
import com.firefly.prdagent.entity.PrdDocument;
import com.firefly.prdagent.exception.ChatErrorCode;
import com.firefly.prdagent.exception.ChatException;
import com.firefly.prdagent.service.ChatMessageService;
import com.firefly.prdagent.service.ChatRunRegistry;
import com.firefly.prdagent.service.ChatSessionService;
import com.firefly.prdagent.service.GroupBroadcastService;
import com.firefly.prdagent.service.GroupSequenceService;
import com.firefly.prdagent.service.PromptAssembler;
import com.firefly.prdagent.vo.ChatStreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatServiceImplTest {

    @Mock
    private ChatSessionService chatSessionService;

    @Mock
    private ChatMessageService chatMessageService;

    @Mock
    private GroupSequenceService groupSequenceService;

    @Mock
    private GroupBroadcastService groupBroadcastService;

    @Mock
    private GroupContextService groupContextService;

    @Mock
    private AIModelFactory modelFactory;

    @Mock
    private AIModel chatModel;

    private final ChatRunRegistry chatRunRegistry = new ChatRunRegistry();

    private ChatServiceImpl chatService;

    @BeforeEach
    void setUp() {
        chatService = new ChatServiceImpl(chatSessionService, chatMessageService, groupSequenceService,
                groupBroadcastService, new PromptAssembler(), new DocCitationExtractor(), groupContextService,
                chatRunRegistry, modelFactory, new ChatProperties(), Runnable::run);
    }

    @Test
    void shouldEmitSingleErrorWhenSessionMissing() {
        when(chatSessionService.requireSession("missing"))
                .thenThrow(new ChatException(ChatErrorCode.SESSION_NOT_FOUND, "会话不存在: missing"));

        List<ChatStreamEvent> events = chatService.streamTurn("missing", "u1", request("你好", null)).collectList().block();

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(ChatStreamEvent.Type.ERROR);
        assertThat(events.get(0).getErrorCode()).isEqualTo("SESSION_NOT_FOUND");
        assertThat(events.get(0).getRunId()).isNotBlank();
        verifyNoInteractions(chatMessageService, modelFactory);
    }

    @Test
    void shouldEmitSingleErrorWhenDocumentMissing() {
        when(chatSessionService.requireSession("s1")).thenReturn(session(null));
        when(chatSessionService.requireDocument("doc-1"))
                .thenThrow(new ChatException(ChatErrorCode.DOCUMENT_NOT_FOUND));

        List<ChatStreamEvent> events = chatService.streamTurn("s1", "u1", request("你好", null)).collectList().block();

        assertThat(events).extracting(ChatStreamEvent::getErrorCode).containsExactly("DOCUMENT_NOT_FOUND");
        verifyNoInteractions(chatMessageService);
    }

    @Test
    void shouldAnswerAsProductManagerByDefault() {
        stubDirectTurn();

        List<ChatStreamEvent> events = chatService.streamTurn("s1", "u1", request("导出上限？", "unknown")).collectList().block();

        assertThat(events.get(0).getType()).isEqualTo(ChatStreamEvent.Type.START);
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(ChatStreamEvent.Type.DONE);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(chatModel).streamGenerate(captor.capture());
        assertThat(captor.getValue().getSystemPrompt()).contains("产品经理");
        assertThat(captor.getValue().getSessionId()).isEqualTo("s1");
        assertThat(captor.getValue().getRunId()).isEqualTo(events.get(0).getRunId());
    }

    @Test
    void shouldHonorRequestedAnswerRole() {
        stubDirectTurn();

        chatService.streamTurn("s1", "u1", request("接口怎么设计？", "dev")).collectList().block();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(chatModel).streamGenerate(captor.capture());
        assertThat(captor.getValue().getSystemPrompt()).contains("开发工程师");
    }

    @Test
    void cancelRunShouldReportUnknownRun() {
        assertThat(chatService.cancelRun("no-such-run")).isFalse();
    }

    private void stubDirectTurn() {
        when(chatSessionService.requireSession("s1")).thenReturn(session(null));
        when(chatSessionService.requireDocument("doc-1")).thenReturn(PrdDocument.builder()
                .id("doc-1").title("报表导出").rawContent("# 报表导出\n\n## 导出范围\n\n单次导出上限为 50000 行。\n").build());
        when(chatMessageService.loadSessionHistory(anyString(), anyString(), anyInt())).thenReturn(List.of());
        when(modelFactory.getChatModel()).thenReturn(chatModel);
        when(chatModel.streamGenerate(any(LlmRequest.class))).thenReturn(Flux.just(LlmChunk.delta("上限是 5 万行。\n"), LlmChunk.done(null)));
    }

    private static ChatSession session(String groupId) {
        return ChatSession.builder().id("s1").groupId(groupId).documentId("doc-1").ownerUserId("u1").build();
    }

    private static SendMessageRequest request(String content, String role) {
        SendMessageRequest request = new SendMessageRequest();
        request.setContent(content);
        request.setAnswerAsRole(role);
        return request;
    }
}
