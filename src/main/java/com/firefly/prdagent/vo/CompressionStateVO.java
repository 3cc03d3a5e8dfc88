package com.firefly.prdagent.vo;

import com.firefly.prdagent.entity.GroupCompressionState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompressionStateVO {

    String groupId;
    Long fromSeq;
    Long toSeq;
    String compressedText;
    Integer originalChars;
    Integer compressedChars;
    LocalDateTime createdAt;

    public static CompressionStateVO from(GroupCompressionState state) {
        return CompressionStateVO.builder()
                .groupId(state.getGroupId())
                .fromSeq(state.getFromSeq())
                .toSeq(state.getToSeq())
                .compressedText(state.getCompressedText())
                .originalChars(state.getOriginalChars())
                .compressedChars(state.getCompressedChars())
                .createdAt(state.getCreatedAt())
                .build();
    }
}
