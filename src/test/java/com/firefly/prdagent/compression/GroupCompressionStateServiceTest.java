package com.firefly.prdagent.compression;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.mapper.GroupCompressionStateMapper;
import com.firefly.prdagent.repository.RedisCompressionStateCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroupCompressionStateServiceTest {

    @Mock
    private GroupCompressionStateMapper stateMapper;

    @Mock
    private RedisCompressionStateCache stateCache;

    @Spy
    private ChatProperties chatProperties = new ChatProperties();

    @InjectMocks
    private GroupCompressionStateService stateService;

    @Test
    void findLiveShouldPreferCache() {
        GroupCompressionState cached = state(1L, 10L, "摘要");
        when(stateCache.get("g1")).thenReturn(Optional.of(cached));

        assertThat(stateService.findLive("g1")).containsSame(cached);
        verifyNoInteractions(stateMapper);
    }

    @Test
    void findLiveShouldFillCacheFromDatabase() {
        GroupCompressionState stored = state(1L, 10L, "摘要");
        when(stateCache.get("g1")).thenReturn(Optional.empty());
        when(stateMapper.findByGroupId("g1")).thenReturn(Optional.of(stored));

        assertThat(stateService.findLive("g1")).containsSame(stored);
        verify(stateCache).put(stored, Duration.ofHours(24));
    }

    @Test
    void shouldAcceptCheckpointThatMovesForward() {
        GroupCompressionState next = state(1L, 20L, "新摘要");
        when(stateMapper.findByGroupId("g1")).thenReturn(Optional.of(state(1L, 20L, "新摘要")));

        boolean accepted = stateService.saveIfNewer(next);

        assertThat(accepted).isTrue();
        assertThat(next.getCreatedAt()).isNotNull();
        verify(stateMapper).upsertIfNewer(next);
        verify(stateCache).put(any(GroupCompressionState.class), eq(Duration.ofHours(24)));
    }

    @Test
    void shouldRejectStaleCheckpointAndRecacheStoredRow() {
        GroupCompressionState stale = state(1L, 15L, "过期摘要");
        GroupCompressionState stored = state(1L, 30L, "更新的摘要");
        when(stateMapper.findByGroupId("g1")).thenReturn(Optional.of(stored));

        boolean accepted = stateService.saveIfNewer(stale);

        assertThat(accepted).isFalse();
        verify(stateCache).put(stored, Duration.ofHours(24));
    }

    @Test
    void shouldRejectInvalidRange() {
        assertThatThrownBy(() -> stateService.saveIfNewer(state(20L, 10L, "x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stateService.saveIfNewer(state(1L, null, "x")))
                .isInstanceOf(IllegalArgumentException.class);
        verify(stateMapper, never()).upsertIfNewer(any());
    }

    private static GroupCompressionState state(Long fromSeq, Long toSeq, String text) {
        return GroupCompressionState.builder()
                .groupId("g1")
                .fromSeq(fromSeq)
                .toSeq(toSeq)
                .compressedText(text)
                .originalChars(1000)
                .compressedChars(text.length())
                .build();
    }
}
