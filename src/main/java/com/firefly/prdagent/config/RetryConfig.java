package com.firefly.prdagent.config;

import com.firefly.prdagent.exception.ChatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.classify.Classifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * 重试机制配置
 * 用于上下文摘要等后台模型调用的容错处理（对话主流程不重试，错误直接推给用户）
 */
@Configuration
@EnableRetry
@Slf4j
public class RetryConfig {

    /**
     * 摘要调用的重试策略
     * - 网络错误/超时/瞬时AI错误: 重试3次
     * - 5xx服务器错误: 重试3次
     * - 429限流错误: 重试3次
     * - 4xx客户端错误(除429外)、非瞬时AI错误: 不重试
     */
    @Bean
    public RetryPolicy summaryRetryPolicy() {
        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(TransientAiException.class, true);
        retryableExceptions.put(ResourceAccessException.class, true);  // 网络异常
        retryableExceptions.put(WebClientRequestException.class, true);
        retryableExceptions.put(SocketTimeoutException.class, true);   // 超时
        retryableExceptions.put(TimeoutException.class, true);
        retryableExceptions.put(HttpServerErrorException.class, true); // 5xx错误
        retryableExceptions.put(WebClientResponseException.class, true);

        SimpleRetryPolicy simpleRetryPolicy = new SimpleRetryPolicy(3, retryableExceptions, true);

        ExceptionClassifierRetryPolicy classifierPolicy = new ExceptionClassifierRetryPolicy();
        classifierPolicy.setExceptionClassifier((Classifier<Throwable, RetryPolicy>) throwable -> {
            if (throwable instanceof HttpClientErrorException.TooManyRequests
                    || throwable instanceof WebClientResponseException.TooManyRequests) {
                log.warn("检测到模型API限流(429)，将重试");
                return simpleRetryPolicy;
            }
            if (throwable instanceof NonTransientAiException
                    || throwable instanceof ChatException
                    || throwable instanceof HttpClientErrorException
                    || throwable instanceof WebClientResponseException
                    && ((WebClientResponseException) throwable).getStatusCode().is4xxClientError()) {
                log.error("模型调用非瞬时错误，不重试: {}", throwable.getMessage());
                return new NeverRetryPolicy();
            }
            return simpleRetryPolicy;
        });

        return classifierPolicy;
    }

    /**
     * 指数退避策略
     * - 初始延迟: 1秒
     * - 最大延迟: 10秒
     * - 倍数: 2 (每次重试延迟翻倍)
     */
    @Bean
    public ExponentialBackOffPolicy summaryBackOffPolicy() {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(1000);
        backOffPolicy.setMaxInterval(10000);
        backOffPolicy.setMultiplier(2.0);
        return backOffPolicy;
    }

    @Bean
    public RetryTemplate summaryRetryTemplate(RetryPolicy summaryRetryPolicy,
                                              ExponentialBackOffPolicy summaryBackOffPolicy) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(summaryRetryPolicy);
        template.setBackOffPolicy(summaryBackOffPolicy);
        return template;
    }
}
