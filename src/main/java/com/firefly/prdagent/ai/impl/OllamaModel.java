package com.firefly.prdagent.ai.impl;

import com.firefly.prdagent.ai.AIModel;
import com.firefly.prdagent.ai.AIModelConfig;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmMessage;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.vo.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ollama本地模型实现
 * 通过 Ollama /api/chat 流式接口（NDJSON）调用本地部署的大语言模型
 */
@Slf4j
public class OllamaModel implements AIModel {

    private final AIModelConfig config;
    private final WebClient webClient;

    public OllamaModel(AIModelConfig config) {
        this(config, WebClient.builder()
                .baseUrl(config.getBaseUrl() != null ? config.getBaseUrl() : "http://localhost:11434")
                .build());
    }

    OllamaModel(AIModelConfig config, WebClient webClient) {
        this.config = config;
        this.webClient = webClient;
        log.info("初始化Ollama模型[{}]: {} (baseUrl: {})", config.getUsage(), config.getModelName(), config.getBaseUrl());
    }

    @Override
    public String getModelName() {
        return config.getModelName();
    }

    @Override
    public Flux<LlmChunk> streamGenerate(LlmRequest request) {
        Map<String, Object> body = Map.of(
                "model", config.getModelName(),
                "messages", toMessages(request),
                "stream", true,
                "options", Map.of(
                        "temperature", config.getTemperature(),
                        "num_predict", config.getMaxTokens()
                )
        );
        return webClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToFlux(Map.class)
                .map(OllamaModel::toChunk)
                .filter(chunk -> chunk.type() != LlmChunk.Type.DELTA || chunk.hasText())
                .doOnError(e -> log.error("Ollama API流式调用失败 runId={}: {}", request.getRunId(), e.getMessage()));
    }

    static LlmChunk toChunk(Map<?, ?> chunk) {
        Object error = chunk.get("error");
        if (error != null) {
            return LlmChunk.error(error.toString());
        }
        if (Boolean.TRUE.equals(chunk.get("done"))) {
            Integer prompt = asInt(chunk.get("prompt_eval_count"));
            Integer completion = asInt(chunk.get("eval_count"));
            TokenUsage usage = null;
            if (prompt != null || completion != null) {
                int p = prompt != null ? prompt : 0;
                int c = completion != null ? completion : 0;
                usage = TokenUsage.builder().promptTokens(p).completionTokens(c).totalTokens(p + c).build();
            }
            return LlmChunk.done(usage);
        }
        Object message = chunk.get("message");
        if (message instanceof Map && ((Map<?, ?>) message).get("content") != null) {
            return LlmChunk.delta(((Map<?, ?>) message).get("content").toString());
        }
        return LlmChunk.delta("");
    }

    private static List<Map<String, String>> toMessages(LlmRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (StringUtils.hasText(request.getSystemPrompt())) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        for (LlmMessage m : request.getMessages()) {
            messages.add(Map.of("role", m.role().name().toLowerCase(Locale.ROOT),
                    "content", m.content() != null ? m.content() : ""));
        }
        return messages;
    }

    private static Integer asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }
}
