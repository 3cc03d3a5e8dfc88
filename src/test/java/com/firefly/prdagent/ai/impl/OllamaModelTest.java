package com.firefly.prdagent.ai.impl;

import com.firefly.prdagent.ai.LlmChunk;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OllamaModelTest {

    @Test
    void shouldMapStreamingLineToDelta() {
        LlmChunk chunk = OllamaModel.toChunk(Map.of(
                "message", Map.of("role", "assistant", "content", "你好"),
                "done", false));

        assertThat(chunk.type()).isEqualTo(LlmChunk.Type.DELTA);
        assertThat(chunk.content()).isEqualTo("你好");
        assertThat(chunk.hasText()).isTrue();
    }

    @Test
    void shouldMapFinalLineToDoneWithUsage() {
        LlmChunk chunk = OllamaModel.toChunk(Map.of(
                "message", Map.of("role", "assistant", "content", ""),
                "done", true,
                "prompt_eval_count", 120,
                "eval_count", 30));

        assertThat(chunk.type()).isEqualTo(LlmChunk.Type.DONE);
        assertThat(chunk.usage().getPromptTokens()).isEqualTo(120);
        assertThat(chunk.usage().getCompletionTokens()).isEqualTo(30);
        assertThat(chunk.usage().getTotalTokens()).isEqualTo(150);
    }

    @Test
    void shouldLeaveUsageEmptyWhenNotReported() {
        LlmChunk chunk = OllamaModel.toChunk(Map.of("done", true));

        assertThat(chunk.type()).isEqualTo(LlmChunk.Type.DONE);
        assertThat(chunk.usage()).isNull();
    }

    @Test
    void shouldMapErrorField() {
        LlmChunk chunk = OllamaModel.toChunk(Map.of("error", "model not found"));

        assertThat(chunk.type()).isEqualTo(LlmChunk.Type.ERROR);
        assertThat(chunk.errorMessage()).isEqualTo("model not found");
    }
}
