package com.firefly.prdagent.ai.impl;

import com.firefly.prdagent.ai.AIModel;
import com.firefly.prdagent.ai.AIModelConfig;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmMessage;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.vo.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OpenAI兼容API模型实现
 * 支持OpenAI官方API及其兼容API（如DeepSeek等）
 */
@Slf4j
public class OpenAICompatibleModel implements AIModel {

    private final AIModelConfig config;
    private final OpenAiChatModel chatModel;

    public OpenAICompatibleModel(AIModelConfig config, OpenAiChatModel chatModel) {
        this.config = config;
        this.chatModel = chatModel;
        log.info("初始化OpenAI兼容模型[{}]: {} (baseUrl: {})", config.getUsage(), config.getModelName(), config.getBaseUrl());
    }

    @Override
    public String getModelName() {
        return config.getModelName();
    }

    @Override
    public Flux<LlmChunk> streamGenerate(LlmRequest request) {
        return Flux.defer(() -> {
            AtomicReference<TokenUsage> usageRef = new AtomicReference<>();
            Prompt prompt = new Prompt(toMessages(request), buildOptions());
            log.debug("OpenAI流式调用开始 purpose={}, runId={}, groupId={}, chars={}",
                    request.getPurpose(), request.getRunId(), request.getGroupId(), request.totalChars());
            return chatModel.stream(prompt)
                    .concatMap(response -> {
                        captureUsage(response, usageRef);
                        String text = extractText(response);
                        return text.isEmpty() ? Flux.<LlmChunk>empty() : Flux.just(LlmChunk.delta(text));
                    })
                    .concatWith(Mono.fromSupplier(() -> LlmChunk.done(usageRef.get())))
                    .doOnError(e -> log.error("OpenAI API流式调用失败 runId={}: {}", request.getRunId(), e.getMessage()));
        });
    }

    private OpenAiChatOptions buildOptions() {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .streamUsage(true);
        if (StringUtils.hasText(config.getModelName())) {
            builder.model(config.getModelName());
        }
        return builder.build();
    }

    private static List<Message> toMessages(LlmRequest request) {
        List<Message> messages = new ArrayList<>();
        if (StringUtils.hasText(request.getSystemPrompt())) {
            messages.add(new SystemMessage(request.getSystemPrompt()));
        }
        for (LlmMessage m : request.getMessages()) {
            messages.add(m.role() == LlmMessage.Role.ASSISTANT
                    ? new AssistantMessage(m.content())
                    : new UserMessage(m.content()));
        }
        return messages;
    }

    private static String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }

    private static void captureUsage(ChatResponse response, AtomicReference<TokenUsage> usageRef) {
        if (response == null || response.getMetadata() == null) {
            return;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null || usage.getTotalTokens() <= 0) {
            return;
        }
        usageRef.set(TokenUsage.builder()
                .promptTokens(usage.getPromptTokens())
                .completionTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .build());
    }
}
