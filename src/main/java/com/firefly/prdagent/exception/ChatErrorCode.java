package com.firefly.prdagent.exception;

import org.springframework.http.HttpStatus;

/**
 * 对话编排错误码；流式接口中以 error 事件下发，普通接口映射为 HTTP 状态。
 */
public enum ChatErrorCode {
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "会话不存在"),
    DOCUMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "PRD文档不存在"),
    INVALID_STAGE(HttpStatus.CONFLICT, "对话阶段状态非法"),
    LLM_ERROR(HttpStatus.BAD_GATEWAY, "模型调用失败"),
    CANCELLED(HttpStatus.OK, "对话已取消"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "服务器内部错误");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ChatErrorCode(HttpStatus httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
