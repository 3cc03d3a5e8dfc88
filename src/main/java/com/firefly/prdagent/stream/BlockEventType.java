package com.firefly.prdagent.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockEventType {
    START("start"),
    DELTA("delta"),
    END("end");

    private final String wireName;

    BlockEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
