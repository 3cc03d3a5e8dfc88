package com.firefly.prdagent.ai;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对话主模型与摘要模型配置；摘要模型未配置 modelName 时复用主模型。
 */
@Data
@ConfigurationProperties(prefix = "app.llm")
public class AIModelProperties {

    private Model chat = new Model();
    private Model summary = new Model();

    @Data
    public static class Model {
        private String type = "openai";
        private String modelName;
        private String baseUrl;
        private String apiKey;
        private double temperature = 0.7;
        private int maxTokens = 4096;

        public AIModelConfig toConfig(String usage) {
            return AIModelConfig.builder()
                    .usage(usage)
                    .type(type)
                    .modelName(modelName)
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .build();
        }
    }
}
