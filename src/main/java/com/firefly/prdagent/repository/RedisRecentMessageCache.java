package com.firefly.prdagent.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.prdagent.entity.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 群最近消息窗口缓存（按 groupSeq 升序的 JSON 列表）。
 * <p>
 * 采用旁路缓存：写消息后 {@link #invalidate} 递增代数并删除窗口；
 * 读未命中时从 MySQL 加载，再用脚本在代数未变化时回填，避免并发写入期间回填旧窗口。
 * Redis 异常一律视为未命中，由调用方回落到 MySQL。
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisRecentMessageCache {

    private static final String RECENT_KEY_PATTERN = "prd:group:%s:recent";
    private static final String GENERATION_KEY_PATTERN = "prd:group:%s:recent:gen";

    private static final DefaultRedisScript<Long> FILL_IF_UNCHANGED = new DefaultRedisScript<>(
            "local gen = redis.call('GET', KEYS[2]) or '0' "
                    + "if gen == ARGV[1] then "
                    + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) return 1 "
                    + "end return 0",
            Long.class);

    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST = new TypeReference<>() {
    };

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * 当前窗口代数；读取失败时返回 null，调用方据此跳过回填
     */
    public String generation(String groupId) {
        try {
            String gen = stringRedisTemplate.opsForValue().get(generationKey(groupId));
            return gen != null ? gen : "0";
        } catch (Exception e) {
            log.warn("读取最近消息窗口代数失败 groupId={}: {}", groupId, e.getMessage());
            return null;
        }
    }

    public Optional<List<ChatMessage>> get(String groupId) {
        try {
            String json = stringRedisTemplate.opsForValue().get(recentKey(groupId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, MESSAGE_LIST));
        } catch (Exception e) {
            log.warn("读取最近消息窗口失败，回落数据库 groupId={}: {}", groupId, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean fillIfUnchanged(String groupId, String generation, List<ChatMessage> window, Duration ttl) {
        if (generation == null) {
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(window);
            Long result = stringRedisTemplate.execute(FILL_IF_UNCHANGED,
                    List.of(recentKey(groupId), generationKey(groupId)),
                    generation, json, String.valueOf(ttl.toMillis()));
            boolean filled = result != null && result == 1L;
            if (!filled) {
                log.debug("最近消息窗口在加载期间被修改，放弃回填 groupId={}", groupId);
            }
            return filled;
        } catch (JsonProcessingException e) {
            log.warn("序列化最近消息窗口失败 groupId={}: {}", groupId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.warn("回填最近消息窗口失败 groupId={}: {}", groupId, e.getMessage());
            return false;
        }
    }

    /**
     * 递增代数并删除窗口，使用 Pipeline 一次往返完成
     */
    public void invalidate(String groupId) {
        try {
            byte[] genKey = generationKey(groupId).getBytes(StandardCharsets.UTF_8);
            byte[] recentKey = recentKey(groupId).getBytes(StandardCharsets.UTF_8);
            stringRedisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                connection.stringCommands().incr(genKey);
                connection.keyCommands().del(recentKey);
                return null;
            });
        } catch (Exception e) {
            log.warn("失效最近消息窗口失败 groupId={}: {}", groupId, e.getMessage());
        }
    }

    private static String recentKey(String groupId) {
        return String.format(RECENT_KEY_PATTERN, groupId);
    }

    private static String generationKey(String groupId) {
        return String.format(GENERATION_KEY_PATTERN, groupId);
    }
}
