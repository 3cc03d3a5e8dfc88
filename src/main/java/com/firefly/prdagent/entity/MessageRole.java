package com.firefly.prdagent.entity;

public enum MessageRole {
    USER, ASSISTANT
}
