package com.firefly.prdagent.messaging;

import com.firefly.prdagent.compression.GroupContextService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class CompressionQueueListener {

    private final GroupContextService groupContextService;

    @RabbitListener(queues = "${app.messaging.compression.queue}", concurrency = "${app.messaging.compression.concurrency:2}")
    public void handle(CompressionRequestPayload payload) {
        if (payload == null || payload.getGroupId() == null) {
            log.warn("收到空的上下文压缩消息，忽略");
            return;
        }
        try {
            groupContextService.compress(payload);
        } catch (Exception e) {
            log.error("消费上下文压缩消息失败 groupId={}, runId={}", payload.getGroupId(), payload.getRunId(), e);
            throw e;
        }
    }
}
