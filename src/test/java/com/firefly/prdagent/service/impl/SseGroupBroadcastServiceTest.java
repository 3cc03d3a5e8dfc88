package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.MessageRole;
import com.firefly.prdagent.service.ChatMessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SseGroupBroadcastServiceTest {

    @Mock
    private ChatMessageService chatMessageService;

    private final ChatProperties chatProperties = new ChatProperties();

    private SseGroupBroadcastService broadcastService;

    @BeforeEach
    void setUp() {
        chatProperties.getHistory().setPageLimit(2);
        // 同步执行器：任务链按提交顺序立即执行
        broadcastService = new SseGroupBroadcastService(Runnable::run, chatMessageService, chatProperties);
    }

    @Test
    void shouldReplayMissedMessagesPageByPageBeforeRegistering() {
        when(chatMessageService.listGroupMessages("g1", 0L, 2)).thenReturn(List.of(message(1L), message(2L)));
        when(chatMessageService.listGroupMessages("g1", 2L, 2)).thenReturn(List.of(message(3L)));

        broadcastService.subscribe("g1", "u1", 0L);

        InOrder order = inOrder(chatMessageService);
        order.verify(chatMessageService).listGroupMessages("g1", 0L, 2);
        order.verify(chatMessageService).listGroupMessages("g1", 2L, 2);
        assertThat(broadcastService.subscriberCount("g1")).isEqualTo(1);
    }

    @Test
    void shouldNotRegisterWhenReplayFails() {
        when(chatMessageService.listGroupMessages("g1", 5L, 2)).thenThrow(new IllegalStateException("db down"));

        broadcastService.subscribe("g1", "u1", 5L);

        assertThat(broadcastService.subscriberCount("g1")).isZero();
    }

    @Test
    void shouldDropSubscriberWhoseConnectionIsClosed() {
        when(chatMessageService.listGroupMessages("g1", 0L, 2)).thenReturn(List.of());
        SseEmitter emitter = broadcastService.subscribe("g1", "u1", 0L);
        assertThat(broadcastService.subscriberCount("g1")).isEqualTo(1);

        emitter.complete();
        broadcastService.publishDelta("g1", "m9", "片段", "b1", true);

        assertThat(broadcastService.subscriberCount("g1")).isZero();
    }

    @Test
    void shouldReleaseGroupChainOnceDrained() {
        when(chatMessageService.listGroupMessages("g1", 0L, 2)).thenReturn(List.of());
        broadcastService.subscribe("g1", "u1", 0L);

        broadcastService.publishDelta("g1", "m9", "片段", "b1", true);
        broadcastService.publishBlockEnd("g1", "m9", "b1");

        assertThat(broadcastService.pendingGroupCount()).isZero();
        assertThat(broadcastService.subscriberCount("g1")).isEqualTo(1);
    }

    @Test
    void shouldDropRejectedEventAndKeepLaterEventsFlowing() {
        AtomicInteger submitted = new AtomicInteger();
        AtomicInteger executed = new AtomicInteger();
        Executor saturatedOnce = command -> {
            if (submitted.incrementAndGet() == 2) {
                throw new RejectedExecutionException("queue full");
            }
            executed.incrementAndGet();
            command.run();
        };
        SseGroupBroadcastService service = new SseGroupBroadcastService(saturatedOnce, chatMessageService, chatProperties);
        when(chatMessageService.listGroupMessages("g1", 0L, 2)).thenReturn(List.of());

        service.subscribe("g1", "u1", 0L);
        service.publishDelta("g1", "m9", "被丢弃的片段", "b1", true);
        service.publishBlockEnd("g1", "m9", "b1");

        assertThat(submitted.get()).isEqualTo(3);
        assertThat(executed.get()).isEqualTo(2);
        assertThat(service.subscriberCount("g1")).isEqualTo(1);
        assertThat(service.pendingGroupCount()).isZero();
    }

    @Test
    void shouldIgnoreMessagesOutsideGroups() {
        ChatMessage direct = ChatMessage.builder().id("d1").sessionId("s1").role(MessageRole.USER).content("hi").build();

        broadcastService.publish(direct);
        broadcastService.publishUpdated(null);

        assertThat(broadcastService.subscriberCount("g1")).isZero();
    }

    private static ChatMessage message(Long seq) {
        return ChatMessage.builder()
                .id("m" + seq)
                .groupId("g1")
                .groupSeq(seq)
                .role(MessageRole.USER)
                .senderUserId("u1")
                .content("消息" + seq)
                .build();
    }
}
