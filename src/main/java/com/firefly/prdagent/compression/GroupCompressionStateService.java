package com.firefly.prdagent.compression;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.mapper.GroupCompressionStateMapper;
import com.firefly.prdagent.repository.RedisCompressionStateCache;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 压缩检查点存取：Redis 缓存在前，MySQL 为准。
 * 写入只前进：新检查点的 toSeq 必须大于已存的 toSeq，否则被拒绝。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupCompressionStateService {

    private final GroupCompressionStateMapper stateMapper;
    private final RedisCompressionStateCache stateCache;
    private final ChatProperties chatProperties;

    public Optional<GroupCompressionState> findLive(String groupId) {
        Optional<GroupCompressionState> cached = stateCache.get(groupId);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<GroupCompressionState> stored = stateMapper.findByGroupId(groupId);
        stored.ifPresent(state -> stateCache.put(state, chatProperties.getCompression().getStateCacheTtl()));
        return stored;
    }

    /**
     * @return 检查点被接受时返回 true；更旧或同等进度的检查点返回 false
     */
    public boolean saveIfNewer(GroupCompressionState state) {
        if (state == null || state.getGroupId() == null || state.getToSeq() == null) {
            throw new IllegalArgumentException("检查点缺少 groupId 或 toSeq");
        }
        if (state.getFromSeq() != null && state.getFromSeq() > state.getToSeq()) {
            throw new IllegalArgumentException("检查点区间非法: [" + state.getFromSeq() + ", " + state.getToSeq() + "]");
        }
        if (state.getCreatedAt() == null) {
            state.setCreatedAt(LocalDateTime.now());
        }
        stateMapper.upsertIfNewer(state);

        // 受影响行数受驱动 useAffectedRows 影响，以回读结果判断是否生效
        Optional<GroupCompressionState> stored = stateMapper.findByGroupId(state.getGroupId());
        boolean accepted = stored
                .map(s -> Objects.equals(s.getToSeq(), state.getToSeq())
                        && Objects.equals(s.getCompressedText(), state.getCompressedText()))
                .orElse(false);
        stored.ifPresent(s -> stateCache.put(s, chatProperties.getCompression().getStateCacheTtl()));

        if (accepted) {
            log.info("保存压缩检查点 groupId={}, range=[{}, {}]", state.getGroupId(), state.getFromSeq(), state.getToSeq());
        } else {
            log.info("压缩检查点已过期被拒绝 groupId={}, toSeq={}, storedToSeq={}", state.getGroupId(),
                    state.getToSeq(), stored.map(GroupCompressionState::getToSeq).orElse(null));
        }
        return accepted;
    }
}
