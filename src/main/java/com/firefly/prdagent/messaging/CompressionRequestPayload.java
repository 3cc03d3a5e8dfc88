package com.firefly.prdagent.messaging;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressionRequestPayload {

    private String groupId;
    /**
     * 触发压缩的轮次
     */
    private String runId;
    /**
     * 触发时的用户提问，作为摘要的相关性提示
     */
    private String userHint;
    private Instant requestedAt;
}
