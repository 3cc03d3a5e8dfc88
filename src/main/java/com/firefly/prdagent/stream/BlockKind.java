package com.firefly.prdagent.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockKind {
    PARAGRAPH("paragraph"),
    HEADING("heading"),
    LIST_ITEM("listItem"),
    CODE_BLOCK("codeBlock");

    private final String wireName;

    BlockKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
