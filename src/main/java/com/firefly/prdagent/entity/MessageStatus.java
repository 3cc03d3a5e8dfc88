package com.firefly.prdagent.entity;

/**
 * 消息完成状态。STREAMING 仅用于助手占位消息，终态为 COMPLETED / FAILED / CANCELLED。
 */
public enum MessageStatus {
    STREAMING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this != STREAMING;
    }
}
