package com.firefly.prdagent.exception;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorCode code;

    public ChatException(ChatErrorCode code) {
        super(code.getDefaultMessage());
        this.code = code;
    }

    public ChatException(ChatErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ChatException(ChatErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
