package com.firefly.prdagent.stream;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 块协议事件：{type, blockId, blockKind, content?, language?}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockToken(BlockEventType type, String blockId, BlockKind blockKind, String content, String language) {

    public static BlockToken start(String blockId, BlockKind kind, String language) {
        return new BlockToken(BlockEventType.START, blockId, kind, null, language);
    }

    public static BlockToken delta(String blockId, BlockKind kind, String content, String language) {
        return new BlockToken(BlockEventType.DELTA, blockId, kind, content, language);
    }

    public static BlockToken end(String blockId, BlockKind kind, String language) {
        return new BlockToken(BlockEventType.END, blockId, kind, null, language);
    }
}
