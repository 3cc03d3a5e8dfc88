package com.firefly.prdagent.ai;

import com.firefly.prdagent.ai.impl.OllamaModel;
import com.firefly.prdagent.ai.impl.OpenAICompatibleModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * AI模型工厂
 * 按类型注册模型创建者，并缓存已创建的模型实例（对话模型 / 摘要模型各一份）
 */
@Component
@Slf4j
public class AIModelFactory {

    private static final String CHAT_KEY = "chat";
    private static final String SUMMARY_KEY = "summary";

    /**
     * 模型创建者函数映射表
     */
    private final Map<String, Function<AIModelConfig, AIModel>> creators = new ConcurrentHashMap<>();

    /**
     * 已创建的模型实例缓存
     */
    private final Map<String, AIModel> modelCache = new ConcurrentHashMap<>();

    private final AIModelProperties properties;

    public AIModelFactory(OpenAiChatModel defaultOpenAiChatModel, AIModelProperties properties) {
        this.properties = properties;
        register("openai", config -> new OpenAICompatibleModel(config, defaultOpenAiChatModel));
        register("ollama", OllamaModel::new);
        log.info("AI模型工厂初始化完成，已注册模型类型: {}", creators.keySet());
    }

    /**
     * 注册模型创建者
     * @param type 模型类型标识
     * @param creator 创建者函数
     */
    public void register(String type, Function<AIModelConfig, AIModel> creator) {
        creators.put(type.toLowerCase(), creator);
        log.debug("注册AI模型创建者: {}", type);
    }

    /**
     * 创建AI模型实例
     * @param config 模型配置
     * @return AI模型实例
     */
    public AIModel create(AIModelConfig config) {
        String type = StringUtils.hasText(config.getType()) ? config.getType().toLowerCase() : "openai";
        Function<AIModelConfig, AIModel> creator = creators.get(type);
        if (creator == null) {
            throw new IllegalArgumentException("不支持的AI模型类型: " + type + "，支持的类型: " + creators.keySet());
        }
        return creator.apply(config);
    }

    /**
     * 对话主模型
     */
    public AIModel getChatModel() {
        return modelCache.computeIfAbsent(CHAT_KEY, k -> create(properties.getChat().toConfig(CHAT_KEY)));
    }

    /**
     * 上下文压缩使用的摘要模型
     */
    public AIModel getSummaryModel() {
        AIModelProperties.Model summary = properties.getSummary();
        if (summary == null || !StringUtils.hasText(summary.getModelName())) {
            return getChatModel();
        }
        return modelCache.computeIfAbsent(SUMMARY_KEY, k -> create(summary.toConfig(SUMMARY_KEY)));
    }
}
