package com.firefly.prdagent.compression;

import com.firefly.prdagent.ai.AIModel;
import com.firefly.prdagent.ai.AIModelFactory;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.config.RetryConfig;
import com.firefly.prdagent.entity.AnswerRole;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.entity.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextSummarizerTest {

    @Mock
    private AIModelFactory modelFactory;

    @Mock
    private AIModel summaryModel;

    private ContextSummarizer summarizer;

    @BeforeEach
    void setUp() {
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new RetryConfig().summaryRetryPolicy());
        retryTemplate.setBackOffPolicy(new NoBackOffPolicy());
        summarizer = new ContextSummarizer(modelFactory, retryTemplate, new ChatProperties());
    }

    @Test
    void shouldBuildCheckpointCoveringCompressedRange() {
        when(modelFactory.getSummaryModel()).thenReturn(summaryModel);
        when(summaryModel.streamGenerate(any(LlmRequest.class)))
                .thenReturn(Flux.just(LlmChunk.delta("- 导出上限 5 万行"), LlmChunk.delta("\n- 待确认：是否支持异步导出"), LlmChunk.done(null)));

        Optional<GroupCompressionState> state = summarizer.summarize("g1", history(3, 5), null, "导出上限是多少？");

        assertThat(state).isPresent();
        assertThat(state.get().getGroupId()).isEqualTo("g1");
        assertThat(state.get().getFromSeq()).isEqualTo(3L);
        assertThat(state.get().getToSeq()).isEqualTo(5L);
        assertThat(state.get().getCompressedText()).isEqualTo("- 导出上限 5 万行\n- 待确认：是否支持异步导出");
        assertThat(state.get().getCompressedChars()).isEqualTo(state.get().getCompressedText().length());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(summaryModel).streamGenerate(captor.capture());
        assertThat(captor.getValue().getPurpose()).isEqualTo(LlmRequest.LlmPurpose.COMPRESSION);
        assertThat(captor.getValue().getSystemPrompt()).isEqualTo(ContextSummarizer.SUMMARY_INSTRUCTION);
    }

    @Test
    void shouldExtendPreviousCheckpoint() {
        when(modelFactory.getSummaryModel()).thenReturn(summaryModel);
        when(summaryModel.streamGenerate(any(LlmRequest.class))).thenReturn(Flux.just(LlmChunk.delta("合并后的摘要")));
        GroupCompressionState previous = GroupCompressionState.builder()
                .groupId("g1").fromSeq(1L).toSeq(10L).compressedText("旧摘要").originalChars(5000).build();
        List<ChatMessage> toCompress = history(11, 12);

        Optional<GroupCompressionState> state = summarizer.summarize("g1", toCompress, previous, null);

        assertThat(state).isPresent();
        assertThat(state.get().getFromSeq()).isEqualTo(1L);
        assertThat(state.get().getToSeq()).isEqualTo(12L);
        assertThat(state.get().getOriginalChars()).isEqualTo(5000 + toCompress.get(0).contentLength() + toCompress.get(1).contentLength());
    }

    @Test
    void shouldRetryTransientFailureThenSucceed() {
        when(modelFactory.getSummaryModel()).thenReturn(summaryModel);
        when(summaryModel.streamGenerate(any(LlmRequest.class)))
                .thenReturn(Flux.error(new TransientAiException("upstream busy")))
                .thenReturn(Flux.just(LlmChunk.delta("摘要")));

        Optional<GroupCompressionState> state = summarizer.summarize("g1", history(1, 2), null, null);

        assertThat(state).map(GroupCompressionState::getCompressedText).contains("摘要");
        verify(summaryModel, times(2)).streamGenerate(any(LlmRequest.class));
    }

    @Test
    void shouldFailOpenOnModelErrorChunkWithoutRetry() {
        when(modelFactory.getSummaryModel()).thenReturn(summaryModel);
        when(summaryModel.streamGenerate(any(LlmRequest.class)))
                .thenReturn(Flux.just(LlmChunk.delta("半截"), LlmChunk.error("context length exceeded")));

        Optional<GroupCompressionState> state = summarizer.summarize("g1", history(1, 2), null, null);

        assertThat(state).isEmpty();
        verify(summaryModel, times(1)).streamGenerate(any(LlmRequest.class));
    }

    @Test
    void shouldFailOpenOnBlankSummary() {
        when(modelFactory.getSummaryModel()).thenReturn(summaryModel);
        when(summaryModel.streamGenerate(any(LlmRequest.class))).thenReturn(Flux.just(LlmChunk.delta("   "), LlmChunk.done(null)));

        assertThat(summarizer.summarize("g1", history(1, 2), null, null)).isEmpty();
    }

    @Test
    void shouldSkipModelCallForEmptyInput() {
        assertThat(summarizer.summarize("g1", List.of(), null, null)).isEmpty();
        verifyNoInteractions(modelFactory);
    }

    @Test
    void transcriptShouldLabelSpeakersAndIncludePreviousSummary() {
        GroupCompressionState previous = GroupCompressionState.builder().fromSeq(1L).toSeq(2L).compressedText("旧摘要").build();

        String transcript = ContextSummarizer.buildTranscript(history(3, 4), previous, "怎么导出？");

        assertThat(transcript).contains("[已有摘要，覆盖序号 1 - 2]\n旧摘要");
        assertThat(transcript).contains("#3 用户(u1): 第3条消息");
        assertThat(transcript).contains("#4 助手(DEV): 第4条消息");
        assertThat(transcript).endsWith("怎么导出？\n");
    }

    private static List<ChatMessage> history(long fromSeq, long toSeq) {
        List<ChatMessage> list = new ArrayList<>();
        for (long seq = fromSeq; seq <= toSeq; seq++) {
            boolean assistant = seq % 2 == 0;
            list.add(ChatMessage.builder()
                    .id("m" + seq)
                    .groupId("g1")
                    .groupSeq(seq)
                    .role(assistant ? MessageRole.ASSISTANT : MessageRole.USER)
                    .senderUserId(assistant ? null : "u1")
                    .answerAsRole(assistant ? AnswerRole.DEV : null)
                    .content("第" + seq + "条消息")
                    .build());
        }
        return list;
    }
}
