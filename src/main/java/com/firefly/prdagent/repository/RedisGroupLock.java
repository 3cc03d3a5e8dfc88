package com.firefly.prdagent.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 群级互斥锁（SET NX PX + 比较删除），用于串行化同一群的压缩任务
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisGroupLock {

    private static final String LOCK_KEY_PATTERN = "prd:group:%s:lock:%s";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    /**
     * @return 加锁成功时返回持有者令牌
     */
    public Optional<String> tryLock(String groupId, String purpose, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(key(groupId, purpose), token, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            return Optional.of(token);
        }
        log.debug("群锁已被占用 groupId={}, purpose={}", groupId, purpose);
        return Optional.empty();
    }

    public void release(String groupId, String purpose, String token) {
        try {
            Long released = stringRedisTemplate.execute(RELEASE_SCRIPT, List.of(key(groupId, purpose)), token);
            if (released == null || released == 0L) {
                log.warn("群锁已过期或被他人持有，跳过释放 groupId={}, purpose={}", groupId, purpose);
            }
        } catch (Exception e) {
            log.warn("释放群锁失败 groupId={}, purpose={}: {}", groupId, purpose, e.getMessage());
        }
    }

    private static String key(String groupId, String purpose) {
        return String.format(LOCK_KEY_PATTERN, groupId, purpose);
    }
}
