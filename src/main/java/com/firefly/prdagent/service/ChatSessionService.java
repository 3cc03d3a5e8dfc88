package com.firefly.prdagent.service;

import com.firefly.prdagent.entity.ChatSession;
import com.firefly.prdagent.entity.PrdDocument;

/**
 * 会话与PRD文档的只读查询
 */
public interface ChatSessionService {

    /**
     * @throws com.firefly.prdagent.exception.ChatException SESSION_NOT_FOUND
     */
    ChatSession requireSession(String sessionId);

    /**
     * @throws com.firefly.prdagent.exception.ChatException DOCUMENT_NOT_FOUND
     */
    PrdDocument requireDocument(String documentId);
}
