package com.firefly.prdagent.service;

import com.firefly.prdagent.dto.SendMessageRequest;
import com.firefly.prdagent.vo.ChatStreamEvent;
import reactor.core.publisher.Flux;

public interface ChatService {

    /**
     * 发起一轮对话，返回推送给提问者的事件流。
     * 会话或文档不存在时流中只有一个 error 事件，且不落库任何消息。
     */
    Flux<ChatStreamEvent> streamTurn(String sessionId, String userId, SendMessageRequest request);

    /**
     * 取消进行中的轮次，已生成的内容以 CANCELLED 状态保存
     */
    boolean cancelRun(String runId);
}
