package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.entity.ChatSession;
import com.firefly.prdagent.entity.PrdDocument;
import com.firefly.prdagent.exception.ChatErrorCode;
import com.firefly.prdagent.exception.ChatException;
import com.firefly.prdagent.mapper.ChatSessionMapper;
import com.firefly.prdagent.mapper.PrdDocumentMapper;
import com.firefly.prdagent.service.ChatSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@RequiredArgsConstructor
public class ChatSessionServiceImpl implements ChatSessionService {

    private final ChatSessionMapper chatSessionMapper;
    private final PrdDocumentMapper prdDocumentMapper;

    @Override
    public ChatSession requireSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new ChatException(ChatErrorCode.SESSION_NOT_FOUND);
        }
        return chatSessionMapper.findById(sessionId)
                .orElseThrow(() -> new ChatException(ChatErrorCode.SESSION_NOT_FOUND, "会话不存在: " + sessionId));
    }

    @Override
    public PrdDocument requireDocument(String documentId) {
        if (!StringUtils.hasText(documentId)) {
            throw new ChatException(ChatErrorCode.DOCUMENT_NOT_FOUND);
        }
        return prdDocumentMapper.findById(documentId)
                .orElseThrow(() -> new ChatException(ChatErrorCode.DOCUMENT_NOT_FOUND, "PRD文档不存在: " + documentId));
    }
}
