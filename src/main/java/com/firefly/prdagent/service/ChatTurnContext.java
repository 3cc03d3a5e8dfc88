package com.firefly.prdagent.service;

import com.firefly.prdagent.entity.AnswerRole;

/**
 * 一轮对话的标识信息，沿调用链显式传递（日志、用量归属、广播均从这里取值）
 *
 * @param groupId 1:1 会话为 null
 */
public record ChatTurnContext(String runId,
                              String sessionId,
                              String groupId,
                              String userId,
                              String documentId,
                              AnswerRole answerAsRole) {

    public boolean isGroupTurn() {
        return groupId != null && !groupId.isBlank();
    }
}
