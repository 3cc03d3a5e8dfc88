package com.firefly.prdagent.messaging;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class CompressionQueueProducer {

    private final RabbitTemplate rabbitTemplate;
    private final CompressionMessagingProperties properties;

    public void publish(CompressionRequestPayload payload) {
        if (payload == null) {
            return;
        }
        if (payload.getRequestedAt() == null) {
            payload.setRequestedAt(Instant.now());
        }
        rabbitTemplate.convertAndSend(properties.getExchange(), properties.getRoutingKey(), payload);
        log.debug("已写入上下文压缩队列 groupId={}, runId={}", payload.getGroupId(), payload.getRunId());
    }
}
