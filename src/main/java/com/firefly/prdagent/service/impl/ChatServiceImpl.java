package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.ai.AIModelFactory;
import com.firefly.prdagent.citation.DocCitationExtractor;
import com.firefly.prdagent.compression.GroupContextService;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.dto.SendMessageRequest;
import com.firefly.prdagent.entity.AnswerRole;
import com.firefly.prdagent.entity.ChatSession;
import com.firefly.prdagent.entity.PrdDocument;
import com.firefly.prdagent.exception.ChatException;
import com.firefly.prdagent.service.ChatMessageService;
import com.firefly.prdagent.service.ChatRunRegistry;
import com.firefly.prdagent.service.ChatService;
import com.firefly.prdagent.service.ChatSessionService;
import com.firefly.prdagent.service.ChatTurnContext;
import com.firefly.prdagent.service.ChatTurnPipeline;
import com.firefly.prdagent.service.GroupBroadcastService;
import com.firefly.prdagent.service.GroupSequenceService;
import com.firefly.prdagent.service.PromptAssembler;
import com.firefly.prdagent.vo.ChatStreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class ChatServiceImpl implements ChatService {

    private final ChatSessionService chatSessionService;
    private final ChatMessageService chatMessageService;
    private final GroupSequenceService groupSequenceService;
    private final GroupBroadcastService groupBroadcastService;
    private final PromptAssembler promptAssembler;
    private final DocCitationExtractor citationExtractor;
    private final GroupContextService groupContextService;
    private final ChatRunRegistry chatRunRegistry;
    private final AIModelFactory modelFactory;
    private final ChatProperties chatProperties;
    private final Scheduler chatStreamScheduler;

    public ChatServiceImpl(ChatSessionService chatSessionService,
                           ChatMessageService chatMessageService,
                           GroupSequenceService groupSequenceService,
                           GroupBroadcastService groupBroadcastService,
                           PromptAssembler promptAssembler,
                           DocCitationExtractor citationExtractor,
                           GroupContextService groupContextService,
                           ChatRunRegistry chatRunRegistry,
                           AIModelFactory modelFactory,
                           ChatProperties chatProperties,
                           @Qualifier("chatStreamExecutor") Executor chatStreamExecutor) {
        this.chatSessionService = chatSessionService;
        this.chatMessageService = chatMessageService;
        this.groupSequenceService = groupSequenceService;
        this.groupBroadcastService = groupBroadcastService;
        this.promptAssembler = promptAssembler;
        this.citationExtractor = citationExtractor;
        this.groupContextService = groupContextService;
        this.chatRunRegistry = chatRunRegistry;
        this.modelFactory = modelFactory;
        this.chatProperties = chatProperties;
        this.chatStreamScheduler = Schedulers.fromExecutor(chatStreamExecutor);
    }

    @Override
    public Flux<ChatStreamEvent> streamTurn(String sessionId, String userId, SendMessageRequest request) {
        Instant receivedAt = Instant.now();
        String runId = UUID.randomUUID().toString();
        return Flux.defer(() -> {
            ChatSession session;
            PrdDocument document;
            try {
                session = chatSessionService.requireSession(sessionId);
                document = chatSessionService.requireDocument(session.getDocumentId());
            } catch (ChatException e) {
                log.warn("对话请求被拒绝 runId={}, sessionId={}, code={}: {}", runId, sessionId, e.getCode(), e.getMessage());
                return Flux.just(ChatStreamEvent.error(runId, null, e.getCode().name(), e.getMessage(), receivedAt));
            }

            AnswerRole role = AnswerRole.parse(request.getAnswerAsRole());
            ChatTurnContext context = new ChatTurnContext(runId, sessionId, session.getGroupId(), userId,
                    document.getId(), role != null ? role : AnswerRole.PM);
            log.info("开始对话轮次 runId={}, sessionId={}, groupId={}, userId={}, role={}",
                    runId, sessionId, context.groupId(), userId, context.answerAsRole());

            ChatTurnPipeline pipeline = new ChatTurnPipeline(context, document, collaborators(), receivedAt);
            return pipeline.run(request.getContent(), request.getReplyToMessageId());
        });
    }

    @Override
    public boolean cancelRun(String runId) {
        return chatRunRegistry.cancel(runId);
    }

    private ChatTurnPipeline.Collaborators collaborators() {
        return new ChatTurnPipeline.Collaborators(
                chatMessageService,
                groupSequenceService,
                groupBroadcastService,
                promptAssembler,
                citationExtractor,
                groupContextService,
                chatRunRegistry,
                modelFactory.getChatModel(),
                chatProperties,
                chatStreamScheduler);
    }
}
