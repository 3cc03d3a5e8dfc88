package com.firefly.prdagent.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 进行中的对话轮次登记表，runId → 取消信号
 */
@Component
@Slf4j
public class ChatRunRegistry {

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    public RunHandle register(String runId, String userId) {
        RunHandle handle = new RunHandle(runId, userId);
        RunHandle previous = runs.putIfAbsent(runId, handle);
        if (previous != null) {
            throw new IllegalStateException("runId 重复: " + runId);
        }
        return handle;
    }

    /**
     * 请求取消一个进行中的轮次
     *
     * @return 找到并首次触发取消时返回 true
     */
    public boolean cancel(String runId) {
        RunHandle handle = runs.get(runId);
        if (handle == null) {
            log.warn("取消对话时未找到runId: {}，可能已结束", runId);
            return false;
        }
        boolean triggered = handle.requestCancel();
        if (triggered) {
            log.info("已请求取消对话 runId={}, userId={}", runId, handle.getUserId());
        }
        return triggered;
    }

    public void remove(String runId) {
        runs.remove(runId);
    }

    public boolean isActive(String runId) {
        return runs.containsKey(runId);
    }

    public static final class RunHandle {

        private final String runId;
        private final String userId;
        private final Sinks.One<Boolean> cancelSink = Sinks.one();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        RunHandle(String runId, String userId) {
            this.runId = runId;
            this.userId = userId;
        }

        public String getRunId() {
            return runId;
        }

        public String getUserId() {
            return userId;
        }

        /**
         * 取消时发出一个值，用于 takeUntilOther 截断上游模型流
         */
        public Mono<Boolean> cancelSignal() {
            return cancelSink.asMono();
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        boolean requestCancel() {
            if (cancelled.compareAndSet(false, true)) {
                cancelSink.tryEmitValue(Boolean.TRUE);
                return true;
            }
            return false;
        }
    }
}
