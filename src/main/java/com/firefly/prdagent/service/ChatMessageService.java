package com.firefly.prdagent.service;

import com.firefly.prdagent.entity.ChatMessage;
import java.util.List;

public interface ChatMessageService {

    void save(ChatMessage message);

    /**
     * 幂等覆盖消息的可变字段（内容、状态、用量、时间）
     */
    void replace(ChatMessage message);

    /**
     * 断线重连补齐：groupSeq &gt; afterSeq 的消息，按序号升序
     */
    List<ChatMessage> listGroupMessages(String groupId, long afterSeq, int limit);

    /**
     * 组装上下文用的群历史：afterSeq &lt; groupSeq &lt; beforeSeq，升序，已剔除进行中的占位消息。
     * 超过加载上限时保留最新的部分。
     */
    List<ChatMessage> loadGroupHistory(String groupId, long afterSeq, Long beforeSeq);

    /**
     * 压缩用的群历史：从 afterSeq 之后按序号连续读取，在第一条仍在生成的消息
     * （或刚分配序号、尚未落库的空位）之前截断，升序。
     */
    List<ChatMessage> loadCompressibleHistory(String groupId, long afterSeq);

    /**
     * 1:1 会话最近历史（升序），排除当前轮次
     */
    List<ChatMessage> loadSessionHistory(String sessionId, String excludeRunId, int limit);
}
