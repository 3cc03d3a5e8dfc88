package com.firefly.prdagent.controller;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.dto.SendMessageRequest;
import com.firefly.prdagent.service.ChatService;
import com.firefly.prdagent.vo.ApiResponse;
import com.firefly.prdagent.vo.ChatStreamEvent;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/v1")
@Slf4j
public class ChatController {

    static final String USER_HEADER = "X-User-Id";

    private static final long SSE_TIMEOUT_MS = 0L; // 不主动中断流

    private final ChatService chatService;
    private final ChatProperties chatProperties;
    private final Executor chatStreamExecutor;
    private final ScheduledExecutorService heartbeatScheduler =
        Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("sse-heartbeat");
            thread.setDaemon(true);
            return thread;
        });

    public ChatController(ChatService chatService,
                          ChatProperties chatProperties,
                          @Qualifier("chatStreamExecutor") Executor chatStreamExecutor) {
        this.chatService = chatService;
        this.chatProperties = chatProperties;
        this.chatStreamExecutor = chatStreamExecutor;
    }

    @PostMapping(value = "/sessions/{sessionId}/messages", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> sendMessage(@PathVariable String sessionId,
                                                  @RequestHeader(USER_HEADER) String userId,
                                                  @Valid @RequestBody SendMessageRequest request) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        // 通过原子标志跟踪是否已完成，避免完成后继续发送
        AtomicBoolean isCompleted = new AtomicBoolean(false);
        final Disposable[] subscriptionRef = new Disposable[1];
        final ScheduledFuture<?>[] heartbeatRef = new ScheduledFuture<?>[1];

        Runnable release = () -> {
            isCompleted.set(true);
            cancelHeartbeat(heartbeatRef[0]);
            // 连接断开时取消订阅，流水线按取消处理并保存已生成的内容
            if (subscriptionRef[0] != null && !subscriptionRef[0].isDisposed()) {
                subscriptionRef[0].dispose();
            }
        };
        emitter.onCompletion(() -> {
            log.debug("SSE连接完成 sessionId={}", sessionId);
            release.run();
        });
        emitter.onTimeout(() -> {
            log.debug("SSE连接超时 sessionId={}", sessionId);
            completeQuietly(emitter, isCompleted);
            release.run();
        });
        emitter.onError(throwable -> {
            log.warn("SSE连接出错 sessionId={}: {}", sessionId, throwable.getMessage());
            completeQuietly(emitter, isCompleted);
            release.run();
        });

        chatStreamExecutor.execute(() -> {
            heartbeatRef[0] = scheduleHeartbeat(emitter, isCompleted, subscriptionRef);
            subscriptionRef[0] = chatService.streamTurn(sessionId, userId, request).subscribe(
                    event -> {
                        if (isCompleted.get()) {
                            return;
                        }
                        try {
                            emitter.send(SseEmitter.event().name(event.getType().getWireName()).data(event));
                        } catch (Exception e) {
                            log.warn("发送SSE数据失败 sessionId={}: {}", sessionId, e.getMessage());
                            completeQuietly(emitter, isCompleted);
                            release.run();
                        }
                    },
                    error -> {
                        log.error("流式对话出错 sessionId={}", sessionId, error);
                        if (!isCompleted.get()) {
                            try {
                                emitter.send(SseEmitter.event().name(ChatStreamEvent.Type.ERROR.getWireName())
                                        .data(ChatStreamEvent.error(null, null, "INTERNAL_ERROR",
                                                error.getMessage(), null)));
                            } catch (Exception e) {
                                log.debug("发送错误信息失败: {}", e.getMessage());
                            }
                        }
                        completeQuietly(emitter, isCompleted);
                        cancelHeartbeat(heartbeatRef[0]);
                    },
                    () -> {
                        completeQuietly(emitter, isCompleted);
                        cancelHeartbeat(heartbeatRef[0]);
                    });
        });

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("Cache-Control", "no-cache")
                .header("Connection", "keep-alive")
                .header("X-Accel-Buffering", "no") // 禁用Nginx缓冲
                .body(emitter);
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<ApiResponse<Map<String, Object>>> cancelRun(@PathVariable String runId,
                                                                       @RequestHeader(USER_HEADER) String userId) {
        boolean cancelled = chatService.cancelRun(runId);
        log.info("用户{}请求取消对话 runId={}, cancelled={}", userId, runId, cancelled);
        Map<String, Object> data = Map.of(
                "runId", runId,
                "cancelled", cancelled
        );
        return ResponseEntity.ok(ApiResponse.success(cancelled ? "已取消" : "对话已结束或不存在", data));
    }

    @PreDestroy
    public void shutdownHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    private ScheduledFuture<?> scheduleHeartbeat(SseEmitter emitter,
                                                 AtomicBoolean isCompleted,
                                                 Disposable[] subscriptionRef) {
        long interval = chatProperties.getSseHeartbeatIntervalMs();
        return heartbeatScheduler.scheduleAtFixedRate(() -> {
            if (isCompleted.get()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().name("heartbeat").data("ping"));
            } catch (Exception heartbeatError) {
                log.debug("发送SSE心跳失败，结束连接: {}", heartbeatError.getMessage());
                completeQuietly(emitter, isCompleted);
                if (subscriptionRef[0] != null && !subscriptionRef[0].isDisposed()) {
                    subscriptionRef[0].dispose();
                }
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void cancelHeartbeat(ScheduledFuture<?> heartbeatFuture) {
        if (heartbeatFuture != null && !heartbeatFuture.isCancelled()) {
            heartbeatFuture.cancel(true);
        }
    }

    private void completeQuietly(SseEmitter emitter, AtomicBoolean isCompleted) {
        if (isCompleted.compareAndSet(false, true)) {
            try {
                emitter.complete();
            } catch (Exception e) {
                log.debug("关闭SSE连接异常: {}", e.getMessage());
            }
        }
    }
}
