package com.firefly.prdagent.compression;

import com.firefly.prdagent.entity.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 上下文压缩规划，纯计算，无副作用
 */
@Component
public class ContextCompressionPlanner {

    /**
     * 兜底压缩时至少保留的原始消息数
     */
    static final int FORCE_MIN_KEEP = 2;

    /**
     * @param messages           未被检查点覆盖的历史，按 groupSeq 升序
     * @param thresholdChars     总字符数超过该值才压缩
     * @param keepRawTargetChars 原样保留部分的目标字符数
     * @param minKeepCount       原样保留的最少消息数
     */
    public CompressionPlan plan(List<ChatMessage> messages, int thresholdChars, int keepRawTargetChars, int minKeepCount) {
        List<ChatMessage> input = messages != null ? messages : Collections.emptyList();
        int totalChars = 0;
        for (ChatMessage m : input) {
            totalChars += m.contentLength();
        }
        if (totalChars <= thresholdChars) {
            return new CompressionPlan(false, totalChars, Collections.emptyList(), new ArrayList<>(input));
        }
        if (input.size() < minKeepCount) {
            return new CompressionPlan(true, totalChars, Collections.emptyList(), new ArrayList<>(input));
        }

        int keepCount = 0;
        int keepChars = 0;
        int split = input.size();
        while (split > 0 && (keepCount < minKeepCount || keepChars < keepRawTargetChars)) {
            split--;
            keepCount++;
            keepChars += input.get(split).contentLength();
        }
        return new CompressionPlan(true, totalChars,
                new ArrayList<>(input.subList(0, split)),
                new ArrayList<>(input.subList(split, input.size())));
    }

    /**
     * 兜底：需要压缩但规划结果没有可压缩的消息（保留条件吞掉了全部历史）时，
     * 从最新往前保留不超过目标字符数的消息，至少保留 2 条，其余移入待压缩。
     */
    public CompressionPlan forceCompress(CompressionPlan plan, int keepRawTargetChars) {
        if (!plan.shouldCompress() || !plan.toCompress().isEmpty() || plan.keepRaw().size() <= FORCE_MIN_KEEP) {
            return plan;
        }
        List<ChatMessage> all = plan.keepRaw();
        int keepCount = 0;
        int keepChars = 0;
        int split = all.size();
        // split 至少留 1 条给待压缩
        while (split > 1) {
            int len = all.get(split - 1).contentLength();
            if (keepCount >= FORCE_MIN_KEEP && keepChars + len > keepRawTargetChars) {
                break;
            }
            split--;
            keepCount++;
            keepChars += len;
        }
        return new CompressionPlan(true, plan.totalChars(),
                new ArrayList<>(all.subList(0, split)),
                new ArrayList<>(all.subList(split, all.size())));
    }
}
