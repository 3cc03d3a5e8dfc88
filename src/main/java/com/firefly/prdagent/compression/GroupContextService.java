package com.firefly.prdagent.compression;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.messaging.CompressionQueueProducer;
import com.firefly.prdagent.messaging.CompressionRequestPayload;
import com.firefly.prdagent.repository.RedisGroupLock;
import com.firefly.prdagent.service.ChatMessageService;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 群上下文窗口管理。
 * <p>
 * 对话时读取当前检查点与其之后的原始历史，超过阈值则投递压缩任务并照常使用未压缩历史；
 * 压缩任务在队列消费线程上加群锁执行，写入只前进，过期的结果会被丢弃。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupContextService {

    static final String LOCK_PURPOSE = "compression";

    private final ChatMessageService chatMessageService;
    private final GroupCompressionStateService compressionStateService;
    private final ContextCompressionPlanner planner;
    private final ContextSummarizer summarizer;
    private final CompressionQueueProducer compressionQueueProducer;
    private final RedisGroupLock groupLock;
    private final ChatProperties chatProperties;

    /**
     * 本轮对话使用的群上下文
     *
     * @param checkpoint        当前有效检查点
     * @param history           检查点之后、当前用户消息之前的原始消息（升序）
     * @param compressionQueued 本轮是否投递了压缩任务
     */
    public record GroupContext(Optional<GroupCompressionState> checkpoint,
                               List<ChatMessage> history,
                               boolean compressionQueued) {
    }

    public GroupContext prepare(String groupId, String runId, Long beforeSeq, String userHint) {
        Optional<GroupCompressionState> checkpoint = compressionStateService.findLive(groupId);
        long afterSeq = checkpoint.map(GroupCompressionState::getToSeq).orElse(0L);
        List<ChatMessage> history = chatMessageService.loadGroupHistory(groupId, afterSeq, beforeSeq);

        ChatProperties.Compression cfg = chatProperties.getCompression();
        CompressionPlan plan = planner.plan(history, cfg.getThresholdChars(), cfg.getKeepRawTargetChars(), cfg.getMinKeepCount());
        boolean queued = false;
        if (plan.shouldCompress()) {
            queued = enqueue(groupId, runId, userHint);
            log.info("群上下文超过阈值，已投递压缩任务 groupId={}, runId={}, totalChars={}, queued={}",
                    groupId, runId, plan.totalChars(), queued);
        }
        return new GroupContext(checkpoint, history, queued);
    }

    /**
     * 执行一次压缩：加锁、重新加载未覆盖的历史、重新规划并生成摘要
     */
    public void compress(CompressionRequestPayload payload) {
        String groupId = payload.getGroupId();
        ChatProperties.Compression cfg = chatProperties.getCompression();
        Optional<String> token = groupLock.tryLock(groupId, LOCK_PURPOSE, cfg.getLockTtl());
        if (token.isEmpty()) {
            log.info("群压缩任务正在进行，跳过 groupId={}, runId={}", groupId, payload.getRunId());
            return;
        }
        try {
            Optional<GroupCompressionState> previous = compressionStateService.findLive(groupId);
            long afterSeq = previous.map(GroupCompressionState::getToSeq).orElse(0L);

            List<ChatMessage> uncovered = chatMessageService.loadCompressibleHistory(groupId, afterSeq);
            CompressionPlan plan = planner.plan(uncovered, cfg.getThresholdChars(), cfg.getKeepRawTargetChars(), cfg.getMinKeepCount());
            if (!plan.shouldCompress()) {
                log.debug("群上下文未超过阈值，无需压缩 groupId={}, totalChars={}", groupId, plan.totalChars());
                return;
            }
            plan = planner.forceCompress(plan, cfg.getKeepRawTargetChars());
            if (!plan.hasWork()) {
                log.info("群上下文超过阈值但消息过少，无法压缩 groupId={}, messages={}", groupId, plan.keepRaw().size());
                return;
            }

            summarizer.summarize(groupId, plan.toCompress(), previous.orElse(null), payload.getUserHint())
                    .ifPresent(compressionStateService::saveIfNewer);
        } finally {
            groupLock.release(groupId, LOCK_PURPOSE, token.get());
        }
    }

    private boolean enqueue(String groupId, String runId, String userHint) {
        try {
            compressionQueueProducer.publish(CompressionRequestPayload.builder()
                    .groupId(groupId)
                    .runId(runId)
                    .userHint(userHint)
                    .build());
            return true;
        } catch (Exception e) {
            log.warn("投递压缩任务失败，本轮使用未压缩历史 groupId={}, runId={}: {}", groupId, runId, e.getMessage());
            return false;
        }
    }
}
