package com.firefly.prdagent.ai;

import lombok.Builder;
import lombok.Data;

/**
 * 单个模型实例的连接与采样参数，由 {@link AIModelProperties.Model#toConfig(String)} 生成
 */
@Data
@Builder
public class AIModelConfig {

    /**
     * 用途标识：chat（对话主模型）或 summary（上下文压缩），只用于日志
     */
    private String usage;

    /**
     * openai 或 ollama，为空按 openai 处理
     */
    private String type;

    private String modelName;

    /**
     * 为空时 openai 走 spring.ai.openai.base-url，ollama 走本机默认端口
     */
    private String baseUrl;

    private String apiKey;

    @Builder.Default
    private double temperature = 0.7;

    /**
     * 单次生成的输出上限
     */
    @Builder.Default
    private int maxTokens = 4096;
}
