package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.mapper.ChatMessageMapper;
import com.firefly.prdagent.service.GroupSequenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 基于 Redis INCR 的群序号分配。
 * 计数器冷启动时用 SETNX 以数据库中的最大序号做种子，重启或缓存丢失后不会复用已分配的序号。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisGroupSequenceService implements GroupSequenceService {

    private static final String SEQ_KEY_PATTERN = "prd:group:%s:seq";

    private final StringRedisTemplate stringRedisTemplate;
    private final ChatMessageMapper chatMessageMapper;

    @Override
    public long next(String groupId) {
        if (!StringUtils.hasText(groupId)) {
            throw new IllegalArgumentException("groupId不能为空");
        }
        String key = String.format(SEQ_KEY_PATTERN, groupId);
        ValueOperations<String, String> ops = stringRedisTemplate.opsForValue();
        if (!Boolean.TRUE.equals(stringRedisTemplate.hasKey(key))) {
            seed(groupId, key, ops);
        }
        Long value = ops.increment(key);
        if (value == null) {
            // 事务/管道模式下 INCR 不返回值
            throw new IllegalStateException("分配群序号失败 groupId=" + groupId);
        }
        return value;
    }

    @Override
    public Long assignIfAbsent(ChatMessage message) {
        if (message == null || !message.isGroupMessage()) {
            return null;
        }
        if (message.getGroupSeq() == null) {
            message.setGroupSeq(next(message.getGroupId()));
        }
        return message.getGroupSeq();
    }

    private void seed(String groupId, String key, ValueOperations<String, String> ops) {
        Long max = chatMessageMapper.findMaxGroupSeq(groupId);
        long seed = max != null ? max : 0L;
        if (Boolean.TRUE.equals(ops.setIfAbsent(key, String.valueOf(seed)))) {
            log.info("群序号计数器初始化 groupId={}, seed={}", groupId, seed);
        }
    }
}
