package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.citation.DocCitation;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.service.ChatMessageService;
import com.firefly.prdagent.service.GroupBroadcastService;
import com.firefly.prdagent.vo.ChatMessageVO;
import com.firefly.prdagent.vo.GroupStreamEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * 基于 SSE 的群广播。
 * <p>
 * 每个群维护一条任务链，事件在 broadcastExecutor 上按投递顺序逐个发送；
 * 发送失败只移除对应的连接，线程池满时丢弃事件，不占用调用方线程。
 */
@Service
@Slf4j
public class SseGroupBroadcastService implements GroupBroadcastService {

    private static final long SSE_TIMEOUT_MS = 0L; // 由客户端主动断开

    private final Map<String, CopyOnWriteArrayList<SseEmitter>> emittersByGroup = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> tailByGroup = new ConcurrentHashMap<>();

    private final Executor broadcastExecutor;
    private final ChatMessageService chatMessageService;
    private final ChatProperties chatProperties;

    public SseGroupBroadcastService(@Qualifier("broadcastExecutor") Executor broadcastExecutor,
                                    ChatMessageService chatMessageService,
                                    ChatProperties chatProperties) {
        this.broadcastExecutor = broadcastExecutor;
        this.chatMessageService = chatMessageService;
        this.chatProperties = chatProperties;
    }

    @Override
    public SseEmitter subscribe(String groupId, String userId, long afterSeq) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        emitter.onTimeout(() -> completeEmitter(groupId, emitter));
        emitter.onCompletion(() -> completeEmitter(groupId, emitter));
        emitter.onError(ex -> completeEmitter(groupId, emitter));
        try {
            emitter.send(SseEmitter.event().name("connected").data("listening"));
        } catch (IOException e) {
            log.debug("群SSE连接初始化失败 groupId={}, userId={}: {}", groupId, userId, e.getMessage());
            completeEmitter(groupId, emitter);
            return emitter;
        }
        // 补发与注册放在同一条任务链上，之后投递的实时事件一定排在补发之后
        enqueue(groupId, () -> {
            if (replay(groupId, emitter, afterSeq)) {
                emittersByGroup.computeIfAbsent(groupId, key -> new CopyOnWriteArrayList<>()).add(emitter);
                log.debug("用户{}订阅群{}，afterSeq={}", userId, groupId, afterSeq);
            }
        });
        return emitter;
    }

    @Override
    public void publish(ChatMessage message) {
        if (message == null || !message.isGroupMessage()) {
            return;
        }
        ChatMessageVO vo = ChatMessageVO.from(message);
        enqueue(message.getGroupId(), () -> sendToGroup(message.getGroupId(), GroupStreamEvent.MESSAGE, vo));
    }

    @Override
    public void publishUpdated(ChatMessage message) {
        if (message == null || !message.isGroupMessage()) {
            return;
        }
        ChatMessageVO vo = ChatMessageVO.from(message);
        enqueue(message.getGroupId(), () -> sendToGroup(message.getGroupId(), GroupStreamEvent.MESSAGE_UPDATED, vo));
    }

    @Override
    public void publishDelta(String groupId, String messageId, String content, String blockId, boolean isFirst) {
        GroupStreamEvent event = GroupStreamEvent.builder()
                .groupId(groupId)
                .messageId(messageId)
                .content(content)
                .blockId(blockId)
                .isFirst(isFirst)
                .build();
        enqueue(groupId, () -> sendToGroup(groupId, GroupStreamEvent.DELTA, event));
    }

    @Override
    public void publishBlockEnd(String groupId, String messageId, String blockId) {
        GroupStreamEvent event = GroupStreamEvent.builder()
                .groupId(groupId)
                .messageId(messageId)
                .blockId(blockId)
                .build();
        enqueue(groupId, () -> sendToGroup(groupId, GroupStreamEvent.BLOCK_END, event));
    }

    @Override
    public void publishCitations(String groupId, String messageId, List<DocCitation> citations) {
        GroupStreamEvent event = GroupStreamEvent.builder()
                .groupId(groupId)
                .messageId(messageId)
                .citations(citations)
                .build();
        enqueue(groupId, () -> sendToGroup(groupId, GroupStreamEvent.CITATIONS, event));
    }

    @PreDestroy
    public void shutdownEmitters() {
        emittersByGroup.forEach((groupId, emitters) -> emitters.forEach(emitter -> completeEmitter(groupId, emitter)));
        emittersByGroup.clear();
        tailByGroup.clear();
    }

    int pendingGroupCount() {
        return tailByGroup.size();
    }

    int subscriberCount(String groupId) {
        List<SseEmitter> emitters = emittersByGroup.get(groupId);
        return emitters != null ? emitters.size() : 0;
    }

    /**
     * 追加到群任务链尾部。线程池拒绝时该事件被丢弃，链条继续；链尾执行完且未被替换时移除。
     */
    private void enqueue(String groupId, Runnable task) {
        if (groupId == null || groupId.isBlank()) {
            return;
        }
        CompletableFuture<Void> next = tailByGroup.compute(groupId, (key, tail) -> {
            CompletableFuture<Void> previous = tail != null
                    ? tail.exceptionally(ex -> null)
                    : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.warn("群广播任务失败 groupId={}: {}", groupId, e.getMessage());
                }
            }, broadcastExecutor);
        });
        next.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("群广播队列已满，丢弃事件 groupId={}: {}", groupId, ex.getMessage());
            }
            tailByGroup.remove(groupId, next);
        });
    }

    private boolean replay(String groupId, SseEmitter emitter, long afterSeq) {
        long cursor = afterSeq;
        int pageLimit = chatProperties.getHistory().getPageLimit();
        try {
            while (true) {
                List<ChatMessage> page = chatMessageService.listGroupMessages(groupId, cursor, pageLimit);
                for (ChatMessage message : page) {
                    emitter.send(SseEmitter.event()
                            .id(String.valueOf(message.getGroupSeq()))
                            .name(GroupStreamEvent.MESSAGE)
                            .data(ChatMessageVO.from(message)));
                    cursor = message.getGroupSeq();
                }
                if (page.size() < pageLimit) {
                    return true;
                }
            }
        } catch (Exception e) {
            log.debug("群消息补发失败 groupId={}, afterSeq={}: {}", groupId, afterSeq, e.getMessage());
            completeEmitter(groupId, emitter);
            return false;
        }
    }

    private void sendToGroup(String groupId, String eventName, Object payload) {
        List<SseEmitter> emitters = emittersByGroup.get(groupId);
        if (emitters == null || emitters.isEmpty()) {
            log.debug("群{}暂无SSE连接，跳过推送 {}", groupId, eventName);
            return;
        }
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
            } catch (Exception e) {
                log.debug("推送群{}事件{}失败: {}", groupId, eventName, e.getMessage());
                completeEmitter(groupId, emitter);
            }
        }
    }

    private void completeEmitter(String groupId, SseEmitter emitter) {
        if (emitter != null) {
            try {
                emitter.complete();
            } catch (Exception e) {
                log.debug("关闭群{}的SSE连接异常: {}", groupId, e.getMessage());
            }
        }
        CopyOnWriteArrayList<SseEmitter> emitters = emittersByGroup.get(groupId);
        if (emitters == null) {
            return;
        }
        emitters.remove(emitter);
        if (emitters.isEmpty()) {
            emittersByGroup.remove(groupId);
        }
    }
}
