package com.firefly.prdagent.citation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocCitation {

    private String headingTitle;

    /**
     * 与文档阅读器生成的锚点一致的 slug
     */
    private String headingId;

    private String excerpt;
    private Double score;
    private Integer rank;
}
