package com.firefly.prdagent.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {
    private Integer promptTokens;
    private Integer completionTokens;
    private Integer totalTokens;

    /**
     * 模型未回报用量时按字符数粗估（约 4 字符 / token）
     */
    public static TokenUsage estimate(int promptChars, int completionChars) {
        int prompt = promptChars / 4;
        int completion = completionChars / 4;
        return TokenUsage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(prompt + completion)
                .build();
    }
}
