package com.firefly.prdagent.service;

import com.firefly.prdagent.entity.ChatMessage;

/**
 * 群消息序号分配：同一群内严格递增、从 1 开始、允许空洞，跨线程与跨实例安全。
 */
public interface GroupSequenceService {

    /**
     * 分配下一个序号
     *
     * @throws IllegalArgumentException groupId 为空
     */
    long next(String groupId);

    /**
     * 仅当消息属于群且尚无序号时分配；已有序号的消息保持不变
     *
     * @return 消息最终的序号，非群消息返回 null
     */
    Long assignIfAbsent(ChatMessage message);
}
