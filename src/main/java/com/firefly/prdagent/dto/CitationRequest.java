package com.firefly.prdagent.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CitationRequest {

    @NotBlank(message = "回答内容不能为空")
    private String answerText;

    private Integer maxCitations;
}
