package com.firefly.prdagent.compression;

import com.firefly.prdagent.entity.ChatMessage;
import java.util.List;

/**
 * 压缩规划结果：toCompress 为需要折叠的最早一段消息，keepRaw 为原样保留的最新消息，二者均保持时间顺序。
 */
public record CompressionPlan(boolean shouldCompress,
                              int totalChars,
                              List<ChatMessage> toCompress,
                              List<ChatMessage> keepRaw) {

    public boolean hasWork() {
        return shouldCompress && !toCompress.isEmpty();
    }
}
