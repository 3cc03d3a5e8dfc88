package com.firefly.prdagent.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.prdagent.entity.GroupCompressionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 压缩检查点缓存，值为整条检查点 JSON，单次 SET 覆盖，读到的永远是完整检查点
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisCompressionStateCache {

    private static final String STATE_KEY_PATTERN = "prd:group:%s:compression";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    public Optional<GroupCompressionState> get(String groupId) {
        try {
            String json = stringRedisTemplate.opsForValue().get(key(groupId));
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, GroupCompressionState.class));
        } catch (Exception e) {
            log.warn("读取压缩检查点缓存失败 groupId={}: {}", groupId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(GroupCompressionState state, Duration ttl) {
        if (state == null || state.getGroupId() == null) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(key(state.getGroupId()), objectMapper.writeValueAsString(state), ttl);
        } catch (Exception e) {
            log.warn("写入压缩检查点缓存失败 groupId={}: {}", state.getGroupId(), e.getMessage());
        }
    }

    private static String key(String groupId) {
        return String.format(STATE_KEY_PATTERN, groupId);
    }
}
