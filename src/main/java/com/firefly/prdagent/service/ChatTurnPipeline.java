package com.firefly.prdagent.service;

import com.firefly.prdagent.ai.AIModel;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.citation.DocCitation;
import com.firefly.prdagent.citation.DocCitationExtractor;
import com.firefly.prdagent.compression.GroupContextService;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.MessageRole;
import com.firefly.prdagent.entity.MessageStatus;
import com.firefly.prdagent.entity.PrdDocument;
import com.firefly.prdagent.exception.ChatErrorCode;
import com.firefly.prdagent.exception.ChatException;
import com.firefly.prdagent.stream.BlockEventType;
import com.firefly.prdagent.stream.BlockToken;
import com.firefly.prdagent.stream.MarkdownBlockTokenizer;
import com.firefly.prdagent.vo.ChatStreamEvent;
import com.firefly.prdagent.vo.TokenUsage;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * 单轮对话流水线，一轮一个实例。
 * <p>
 * 用户消息落库并广播后调用模型；首个有效片段到达时分配助手序号并写入 STREAMING 占位消息，
 * 之后每个片段经块切分推给提问者，群会话同时广播给其他成员。
 * 结束时（完成 / 模型错误 / 取消 / 超时）助手消息只收尾一次。
 */
@Slf4j
public class ChatTurnPipeline {

    /**
     * 流水线依赖的服务
     *
     * @param scheduler 模型片段的处理线程
     */
    public record Collaborators(ChatMessageService messageService,
                                GroupSequenceService sequenceService,
                                GroupBroadcastService broadcastService,
                                PromptAssembler promptAssembler,
                                DocCitationExtractor citationExtractor,
                                GroupContextService groupContextService,
                                ChatRunRegistry runRegistry,
                                AIModel model,
                                ChatProperties properties,
                                Scheduler scheduler) {
    }

    private final ChatTurnContext context;
    private final PrdDocument document;
    private final Collaborators deps;
    private final Instant requestReceivedAt;
    private final String assistantMessageId = UUID.randomUUID().toString();

    private final MarkdownBlockTokenizer tokenizer = new MarkdownBlockTokenizer();
    private final StringBuilder answer = new StringBuilder();
    private final AtomicBoolean finalized = new AtomicBoolean(false);

    private volatile ChatTurnStage stage = ChatTurnStage.IDLE;
    private volatile ChatMessage userMessage;
    private volatile ChatMessage assistantMessage;
    private volatile Instant firstTokenAt;
    private volatile TokenUsage reportedUsage;
    private int promptChars;
    private boolean firstDeltaBroadcast = true;

    public ChatTurnPipeline(ChatTurnContext context, PrdDocument document, Collaborators deps, Instant requestReceivedAt) {
        this.context = context;
        this.document = document;
        this.deps = deps;
        this.requestReceivedAt = requestReceivedAt;
    }

    public Flux<ChatStreamEvent> run(String userContent, String replyToMessageId) {
        return Flux.defer(() -> {
            ChatRunRegistry.RunHandle handle;
            LlmRequest request;
            try {
                persistUserMessage(userContent, replyToMessageId);
                request = buildRequest(userContent);
                handle = deps.runRegistry().register(context.runId(), context.userId());
                transition(ChatTurnStage.AWAITING_FIRST_TOKEN);
            } catch (Exception e) {
                log.error("对话轮次准备失败 runId={}, sessionId={}, groupId={}", context.runId(), context.sessionId(),
                        context.groupId(), e);
                transition(ChatTurnStage.ERRORED);
                ChatErrorCode code = e instanceof ChatException ? ((ChatException) e).getCode() : ChatErrorCode.INTERNAL_ERROR;
                return Flux.just(ChatStreamEvent.error(context.runId(), null, code.name(), e.getMessage(), requestReceivedAt));
            }

            ChatProperties props = deps.properties();
            Flux<ChatStreamEvent> body = deps.model().streamGenerate(request)
                    .onErrorMap(e -> !(e instanceof ChatException),
                            e -> new ChatException(ChatErrorCode.LLM_ERROR, describe(e), e))
                    .timeout(props.getStreamIdleTimeout())
                    .takeUntilOther(handle.cancelSignal())
                    .onBackpressureBuffer(props.getStreamBufferSize())
                    .publishOn(deps.scheduler())
                    .concatMap(this::onChunk)
                    .concatWith(Flux.defer(() -> handle.isCancelled() ? finishCancelled("用户取消") : complete()))
                    .onErrorResume(this::fail);

            return Flux.concat(Flux.just(startEvent()), body)
                    .doOnCancel(() -> cancelSilently("连接断开"))
                    .doFinally(signal -> deps.runRegistry().remove(context.runId()));
        });
    }

    public ChatTurnStage getStage() {
        return stage;
    }

    public String getAssistantMessageId() {
        return assistantMessageId;
    }

    synchronized void transition(ChatTurnStage next) {
        if (!stage.canTransitionTo(next)) {
            throw new ChatException(ChatErrorCode.INVALID_STAGE, "非法阶段切换: " + stage + " -> " + next);
        }
        log.debug("对话阶段切换 runId={}: {} -> {}", context.runId(), stage, next);
        stage = next;
    }

    private void persistUserMessage(String userContent, String replyToMessageId) {
        ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(context.sessionId())
                .groupId(context.groupId())
                .role(MessageRole.USER)
                .senderUserId(context.userId())
                .content(userContent)
                .runId(context.runId())
                .replyToMessageId(replyToMessageId)
                .status(MessageStatus.COMPLETED)
                .timestamp(LocalDateTime.ofInstant(requestReceivedAt, ZoneId.systemDefault()))
                .build();
        deps.sequenceService().assignIfAbsent(message);
        deps.messageService().save(message);
        userMessage = message;
        if (context.isGroupTurn()) {
            deps.broadcastService().publish(message);
        }
    }

    private LlmRequest buildRequest(String userContent) {
        LlmRequest request;
        if (context.isGroupTurn()) {
            GroupContextService.GroupContext groupContext = deps.groupContextService()
                    .prepare(context.groupId(), context.runId(), userMessage.getGroupSeq(), userContent);
            request = deps.promptAssembler().assemble(context, document, groupContext.checkpoint(),
                    groupContext.history(), userContent);
        } else {
            List<ChatMessage> history = deps.messageService()
                    .loadSessionHistory(context.sessionId(), context.runId(), deps.properties().getSessionHistoryLimit());
            request = deps.promptAssembler().assemble(context, document, Optional.empty(), history, userContent);
        }
        promptChars = request.totalChars();
        return request;
    }

    private ChatStreamEvent startEvent() {
        return ChatStreamEvent.builder()
                .type(ChatStreamEvent.Type.START)
                .runId(context.runId())
                .messageId(assistantMessageId)
                .userMessageId(userMessage.getId())
                .userSeq(userMessage.getGroupSeq())
                .requestReceivedAt(requestReceivedAt)
                .build();
    }

    private Flux<ChatStreamEvent> onChunk(LlmChunk chunk) {
        if (chunk.type() == LlmChunk.Type.ERROR) {
            String message = chunk.errorMessage() != null ? chunk.errorMessage() : "模型返回错误";
            return Flux.error(new ChatException(ChatErrorCode.LLM_ERROR, message));
        }
        if (chunk.type() == LlmChunk.Type.DONE) {
            if (chunk.usage() != null) {
                reportedUsage = chunk.usage();
            }
            return Flux.empty();
        }
        if (!chunk.hasText()) {
            return Flux.empty();
        }
        return Flux.fromIterable(onDelta(chunk.content()));
    }

    private synchronized List<ChatStreamEvent> onDelta(String content) {
        if (stage == ChatTurnStage.AWAITING_FIRST_TOKEN) {
            onFirstToken();
        }
        if (stage != ChatTurnStage.STREAMING) {
            return Collections.emptyList();
        }
        answer.append(content);
        return toEvents(tokenizer.push(content));
    }

    private void onFirstToken() {
        firstTokenAt = Instant.now();
        transition(ChatTurnStage.STREAMING);
        ChatMessage placeholder = newAssistantMessage(MessageStatus.STREAMING, "",
                LocalDateTime.ofInstant(firstTokenAt, ZoneId.systemDefault()));
        deps.sequenceService().assignIfAbsent(placeholder);
        deps.messageService().save(placeholder);
        assistantMessage = placeholder;
        if (context.isGroupTurn()) {
            deps.broadcastService().publish(placeholder);
        }
        log.debug("首个token到达 runId={}, seq={}, 耗时{}ms", context.runId(), placeholder.getGroupSeq(),
                firstTokenAt.toEpochMilli() - requestReceivedAt.toEpochMilli());
    }

    private List<ChatStreamEvent> toEvents(List<BlockToken> tokens) {
        List<ChatStreamEvent> events = new ArrayList<>(tokens.size());
        for (BlockToken token : tokens) {
            events.add(ChatStreamEvent.fromBlock(token, assistantMessageId, context.runId()));
            if (!context.isGroupTurn()) {
                continue;
            }
            if (token.type() == BlockEventType.DELTA) {
                deps.broadcastService().publishDelta(context.groupId(), assistantMessageId, token.content(),
                        token.blockId(), firstDeltaBroadcast);
                firstDeltaBroadcast = false;
            } else if (token.type() == BlockEventType.END) {
                deps.broadcastService().publishBlockEnd(context.groupId(), assistantMessageId, token.blockId());
            }
        }
        return events;
    }

    private synchronized Flux<ChatStreamEvent> complete() {
        if (stage.isTerminal()) {
            return Flux.empty();
        }
        transition(ChatTurnStage.FLUSHING);
        List<ChatStreamEvent> events = new ArrayList<>(toEvents(tokenizer.flush()));

        transition(ChatTurnStage.FINALIZING);
        String answerText = answer.toString();
        List<DocCitation> citations = extractCitations(answerText);
        if (!citations.isEmpty()) {
            events.add(ChatStreamEvent.builder()
                    .type(ChatStreamEvent.Type.CITATIONS)
                    .runId(context.runId())
                    .messageId(assistantMessageId)
                    .citations(citations)
                    .build());
            if (context.isGroupTurn()) {
                deps.broadcastService().publishCitations(context.groupId(), assistantMessageId, citations);
            }
        }

        TokenUsage usage = resolveUsage(answerText);
        finalizeAssistant(MessageStatus.COMPLETED, answerText, usage);
        transition(ChatTurnStage.DONE);

        Instant completedAt = Instant.now();
        events.add(ChatStreamEvent.builder()
                .type(ChatStreamEvent.Type.DONE)
                .runId(context.runId())
                .messageId(assistantMessageId)
                .tokenUsage(usage)
                .requestReceivedAt(requestReceivedAt)
                .firstTokenAt(firstTokenAt)
                .completedAt(completedAt)
                .build());
        log.info("对话轮次完成 runId={}, sessionId={}, groupId={}, chars={}, citations={}, 耗时{}ms",
                context.runId(), context.sessionId(), context.groupId(), answerText.length(), citations.size(),
                completedAt.toEpochMilli() - requestReceivedAt.toEpochMilli());
        return Flux.fromIterable(events);
    }

    private Flux<ChatStreamEvent> fail(Throwable error) {
        if (error instanceof TimeoutException) {
            return finishCancelled("模型响应超时");
        }
        ChatErrorCode code = error instanceof ChatException ? ((ChatException) error).getCode() : ChatErrorCode.INTERNAL_ERROR;
        String message = error.getMessage() != null ? error.getMessage() : code.getDefaultMessage();
        log.error("对话轮次失败 runId={}, sessionId={}, groupId={}, code={}: {}", context.runId(), context.sessionId(),
                context.groupId(), code, message, error);

        List<ChatStreamEvent> events = new ArrayList<>();
        synchronized (this) {
            boolean wasStreaming = stage == ChatTurnStage.STREAMING;
            if (!stage.isTerminal()) {
                transition(ChatTurnStage.ERRORED);
            }
            if (wasStreaming) {
                events.addAll(toEvents(tokenizer.flush()));
            }
            String partial = answer.toString();
            String content = partial.isBlank() ? "（回答生成失败：" + message + "）" : partial;
            safeFinalize(MessageStatus.FAILED, content, resolveUsage(partial));
        }
        events.add(ChatStreamEvent.error(context.runId(), assistantMessageId, code.name(), message, requestReceivedAt));
        return Flux.fromIterable(events);
    }

    private synchronized Flux<ChatStreamEvent> finishCancelled(String reason) {
        if (stage.isTerminal()) {
            return Flux.empty();
        }
        boolean wasStreaming = stage == ChatTurnStage.STREAMING;
        transition(ChatTurnStage.CANCELLED);
        List<ChatStreamEvent> events = new ArrayList<>();
        if (wasStreaming) {
            events.addAll(toEvents(tokenizer.flush()));
        }
        finalizeCancelled(reason);
        events.add(ChatStreamEvent.error(context.runId(), assistantMessageId, ChatErrorCode.CANCELLED.name(), reason,
                requestReceivedAt));
        return Flux.fromIterable(events);
    }

    private synchronized void cancelSilently(String reason) {
        if (stage.isTerminal()) {
            return;
        }
        transition(ChatTurnStage.CANCELLED);
        finalizeCancelled(reason);
    }

    private void finalizeCancelled(String reason) {
        String partial = answer.toString();
        log.info("对话轮次取消 runId={}, sessionId={}, groupId={}, reason={}, partialChars={}", context.runId(),
                context.sessionId(), context.groupId(), reason, partial.length());
        if (assistantMessage == null) {
            // 还没有任何输出，不留下空的助手消息
            finalized.set(true);
            return;
        }
        safeFinalize(MessageStatus.CANCELLED, partial, resolveUsage(partial));
    }

    private void safeFinalize(MessageStatus status, String content, TokenUsage usage) {
        try {
            finalizeAssistant(status, content, usage);
        } catch (Exception e) {
            log.error("保存助手消息终态失败 runId={}, status={}", context.runId(), status, e);
        }
    }

    /**
     * 助手消息收尾，每轮只成功执行一次：已有占位消息则覆盖并广播更新，否则新建并广播。
     * 写库失败时撤销标记，由后续的 FAILED / CANCELLED 收尾再写一次。
     */
    private synchronized void finalizeAssistant(MessageStatus status, String content, TokenUsage usage) {
        if (!finalized.compareAndSet(false, true)) {
            return;
        }
        try {
            writeAssistant(status, content, usage);
        } catch (RuntimeException e) {
            finalized.set(false);
            throw e;
        }
    }

    private void writeAssistant(MessageStatus status, String content, TokenUsage usage) {
        ChatMessage message = assistantMessage;
        if (message != null) {
            message.setContent(content);
            message.setStatus(status);
            message.setInputTokens(usage.getPromptTokens());
            message.setOutputTokens(usage.getCompletionTokens());
            deps.messageService().replace(message);
            if (context.isGroupTurn()) {
                deps.broadcastService().publishUpdated(message);
            }
        } else {
            message = newAssistantMessage(status, content, LocalDateTime.now());
            message.setInputTokens(usage.getPromptTokens());
            message.setOutputTokens(usage.getCompletionTokens());
            deps.sequenceService().assignIfAbsent(message);
            deps.messageService().save(message);
            assistantMessage = message;
            if (context.isGroupTurn()) {
                deps.broadcastService().publish(message);
            }
        }
    }

    private ChatMessage newAssistantMessage(MessageStatus status, String content, LocalDateTime timestamp) {
        return ChatMessage.builder()
                .id(assistantMessageId)
                .sessionId(context.sessionId())
                .groupId(context.groupId())
                .role(MessageRole.ASSISTANT)
                .content(content)
                .runId(context.runId())
                .replyToMessageId(userMessage != null ? userMessage.getId() : null)
                .answerAsRole(context.answerAsRole())
                .status(status)
                .timestamp(timestamp)
                .build();
    }

    private List<DocCitation> extractCitations(String answerText) {
        if (document == null) {
            return Collections.emptyList();
        }
        return deps.citationExtractor().extract(document.getRawContent(), answerText, deps.properties().getMaxCitations());
    }

    private TokenUsage resolveUsage(String answerText) {
        TokenUsage usage = reportedUsage;
        return usage != null ? usage : TokenUsage.estimate(promptChars, answerText.length());
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
