package com.firefly.prdagent.entity;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrdDocument {

    private String id;
    private String title;

    /**
     * 原始 Markdown，引用抽取直接基于原文重新解析标题
     */
    private String rawContent;

    private LocalDateTime createdAt;
}
