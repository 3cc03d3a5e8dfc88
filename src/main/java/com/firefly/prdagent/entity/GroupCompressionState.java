package com.firefly.prdagent.entity;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 群上下文压缩检查点：[fromSeq, toSeq] 区间内的原始消息已折叠进 compressedText。
 * 每个群只有一个有效检查点，toSeq 只增不减。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GroupCompressionState {

    private String groupId;
    private Long fromSeq;
    private Long toSeq;
    private String compressedText;
    private Integer originalChars;
    private Integer compressedChars;
    private LocalDateTime createdAt;
}
