package com.firefly.prdagent.service;

import com.firefly.prdagent.citation.DocCitation;
import com.firefly.prdagent.entity.ChatMessage;
import java.util.List;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * 群内事件广播。所有 publish 方法都是异步投递，调用方不会因推送失败而失败；
 * 同一个群的事件按调用顺序送达。
 */
public interface GroupBroadcastService {

    /**
     * 订阅群事件：先补发 groupSeq &gt; afterSeq 的已持久化消息，再接收实时事件
     */
    SseEmitter subscribe(String groupId, String userId, long afterSeq);

    void publish(ChatMessage message);

    void publishUpdated(ChatMessage message);

    void publishDelta(String groupId, String messageId, String content, String blockId, boolean isFirst);

    void publishBlockEnd(String groupId, String messageId, String blockId);

    void publishCitations(String groupId, String messageId, List<DocCitation> citations);
}
