package com.firefly.prdagent.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * 单轮对话阶段：IDLE → AWAITING_FIRST_TOKEN → STREAMING → FLUSHING → FINALIZING → DONE，
 * 任意非终态都可以进入 ERRORED / CANCELLED。
 */
public enum ChatTurnStage {
    IDLE,
    AWAITING_FIRST_TOKEN,
    STREAMING,
    FLUSHING,
    FINALIZING,
    DONE,
    ERRORED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == ERRORED || this == CANCELLED;
    }

    public boolean canTransitionTo(ChatTurnStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ERRORED || next == CANCELLED) {
            return true;
        }
        return allowedNext().contains(next);
    }

    private Set<ChatTurnStage> allowedNext() {
        switch (this) {
            case IDLE:
                return EnumSet.of(AWAITING_FIRST_TOKEN);
            case AWAITING_FIRST_TOKEN:
                // 模型没有任何输出时直接收尾
                return EnumSet.of(STREAMING, FLUSHING);
            case STREAMING:
                return EnumSet.of(FLUSHING);
            case FLUSHING:
                return EnumSet.of(FINALIZING);
            case FINALIZING:
                return EnumSet.of(DONE);
            default:
                return EnumSet.noneOf(ChatTurnStage.class);
        }
    }
}
