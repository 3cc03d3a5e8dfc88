package com.firefly.prdagent.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对话编排配置（app.chat）
 */
@Data
@ConfigurationProperties(prefix = "app.chat")
public class ChatProperties {

    /**
     * 模型流与下游处理之间的缓冲片段数
     */
    private int streamBufferSize = 256;

    /**
     * 模型两个片段之间的最长等待时间，超时按取消处理
     */
    private Duration streamIdleTimeout = Duration.ofMinutes(2);

    /**
     * 1:1 会话组装上下文时带入的历史消息条数
     */
    private int sessionHistoryLimit = 40;

    private long sseHeartbeatIntervalMs = 15000L;

    private int maxCitations = 12;

    private Compression compression = new Compression();

    private History history = new History();

    @Data
    public static class Compression {
        private int thresholdChars = 50000;
        private int keepRawTargetChars = 20000;
        private int minKeepCount = 8;
        private Duration stateCacheTtl = Duration.ofHours(24);
        private Duration lockTtl = Duration.ofMinutes(5);
        private Duration summaryTimeout = Duration.ofMinutes(2);
        /**
         * STREAMING 消息超过该时长没有更新视为已中断，压缩不再等待它
         */
        private Duration inFlightStaleAfter = Duration.ofMinutes(30);
        /**
         * 序号空位的等待时间：分配序号到落库之间的窗口
         */
        private Duration sequenceGapGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class History {
        /**
         * 组装上下文时最多加载的未压缩消息数
         */
        private int loadLimit = 1000;
        /**
         * Redis 最近消息窗口大小
         */
        private int recentCacheSize = 200;
        private Duration recentCacheTtl = Duration.ofMinutes(10);
        /**
         * 群消息分页查询上限
         */
        private int pageLimit = 200;
    }
}
