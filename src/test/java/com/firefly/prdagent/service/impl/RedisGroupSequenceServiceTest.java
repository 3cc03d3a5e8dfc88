package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.mapper.ChatMessageMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisGroupSequenceServiceTest {

    private static final String KEY = "prd:group:g1:seq";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private ChatMessageMapper chatMessageMapper;

    @InjectMocks
    private RedisGroupSequenceService sequenceService;

    @Test
    void shouldSeedCounterFromDatabaseOnColdStart() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.hasKey(KEY)).thenReturn(false);
        when(chatMessageMapper.findMaxGroupSeq("g1")).thenReturn(41L);
        when(valueOperations.setIfAbsent(KEY, "41")).thenReturn(true);
        when(valueOperations.increment(KEY)).thenReturn(42L);

        assertThat(sequenceService.next("g1")).isEqualTo(42L);
    }

    @Test
    void shouldNotReseedExistingCounter() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.hasKey(KEY)).thenReturn(true);
        when(valueOperations.increment(KEY)).thenReturn(7L);

        assertThat(sequenceService.next("g1")).isEqualTo(7L);
        verify(chatMessageMapper, never()).findMaxGroupSeq(anyString());
    }

    @Test
    void shouldDelegateEveryAllocationToRedisIncrementUnderConcurrency() throws Exception {
        AtomicLong counter = new AtomicLong();
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.hasKey(KEY)).thenReturn(true);
        when(valueOperations.increment(KEY)).thenAnswer(invocation -> counter.incrementAndGet());

        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        seen.add(sequenceService.next("g1"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // 每次 next 都落到一次 INCR，服务端不缓存也不复用序号
        verify(valueOperations, times(threads * perThread)).increment(KEY);
        assertThat(seen).hasSize(threads * perThread);
        assertThat(seen).allMatch(seq -> seq >= 1 && seq <= counter.get());
    }

    @Test
    void shouldRejectBlankGroupId() {
        assertThatThrownBy(() -> sequenceService.next(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sequenceService.next(null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(stringRedisTemplate);
    }

    @Test
    void shouldFailWhenIncrementReturnsNothing() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.hasKey(KEY)).thenReturn(true);
        when(valueOperations.increment(KEY)).thenReturn(null);

        assertThatThrownBy(() -> sequenceService.next("g1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void assignIfAbsentShouldKeepExistingSequenceAndSkipDirectMessages() {
        ChatMessage sequenced = ChatMessage.builder().id("m1").groupId("g1").groupSeq(5L).build();
        ChatMessage direct = ChatMessage.builder().id("m2").sessionId("s1").build();

        assertThat(sequenceService.assignIfAbsent(sequenced)).isEqualTo(5L);
        assertThat(sequenceService.assignIfAbsent(direct)).isNull();
        assertThat(direct.getGroupSeq()).isNull();
        verifyNoInteractions(stringRedisTemplate);
    }

    @Test
    void assignIfAbsentShouldSequenceNewGroupMessage() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.hasKey(KEY)).thenReturn(true);
        when(valueOperations.increment(KEY)).thenReturn(12L);
        ChatMessage message = ChatMessage.builder().id("m1").groupId("g1").build();

        assertThat(sequenceService.assignIfAbsent(message)).isEqualTo(12L);
        assertThat(message.getGroupSeq()).isEqualTo(12L);
    }
}
