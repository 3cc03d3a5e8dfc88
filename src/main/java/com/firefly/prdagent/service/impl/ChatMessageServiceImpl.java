package com.firefly.prdagent.service.impl;

import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.MessageStatus;
import com.firefly.prdagent.mapper.ChatMessageMapper;
import com.firefly.prdagent.repository.RedisRecentMessageCache;
import com.firefly.prdagent.service.ChatMessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatMessageServiceImpl implements ChatMessageService {

    private final ChatMessageMapper chatMessageMapper;
    private final RedisRecentMessageCache recentMessageCache;
    private final ChatProperties chatProperties;

    @Override
    public void save(ChatMessage message) {
        LocalDateTime now = LocalDateTime.now();
        if (message.getTimestamp() == null) {
            message.setTimestamp(now);
        }
        message.setUpdatedAt(now);
        chatMessageMapper.batchInsert(List.of(message));
        if (message.isGroupMessage()) {
            recentMessageCache.invalidate(message.getGroupId());
        }
        log.debug("保存消息 id={}, groupId={}, seq={}, status={}",
                message.getId(), message.getGroupId(), message.getGroupSeq(), message.getStatus());
    }

    @Override
    public void replace(ChatMessage message) {
        message.setUpdatedAt(LocalDateTime.now());
        int rows = chatMessageMapper.replace(message);
        if (rows == 0) {
            log.warn("覆盖消息未命中任何记录 id={}", message.getId());
        }
        if (message.isGroupMessage()) {
            recentMessageCache.invalidate(message.getGroupId());
        }
    }

    @Override
    public List<ChatMessage> listGroupMessages(String groupId, long afterSeq, int limit) {
        int pageLimit = chatProperties.getHistory().getPageLimit();
        int safeLimit = Math.max(1, Math.min(limit, pageLimit));
        return chatMessageMapper.findByGroupAfterSeq(groupId, Math.max(0L, afterSeq), safeLimit);
    }

    @Override
    public List<ChatMessage> loadGroupHistory(String groupId, long afterSeq, Long beforeSeq) {
        ChatProperties.History history = chatProperties.getHistory();
        List<ChatMessage> window = loadRecentWindow(groupId, history);

        List<ChatMessage> source;
        if (windowCovers(window, afterSeq, history.getRecentCacheSize())) {
            source = window;
        } else {
            // 从最新往前取，超出上限时丢掉的是最早的消息
            source = new ArrayList<>(chatMessageMapper.findByGroupDesc(groupId, beforeSeq, history.getLoadLimit()));
            Collections.reverse(source);
        }

        List<ChatMessage> result = source.stream()
                .filter(m -> m.getGroupSeq() != null && m.getGroupSeq() > afterSeq)
                .filter(m -> beforeSeq == null || m.getGroupSeq() < beforeSeq)
                .filter(ChatMessageServiceImpl::usableAsContext)
                .collect(Collectors.toList());
        if (result.size() > history.getLoadLimit()) {
            result = new ArrayList<>(result.subList(result.size() - history.getLoadLimit(), result.size()));
        }
        return result;
    }

    @Override
    public List<ChatMessage> loadCompressibleHistory(String groupId, long afterSeq) {
        ChatProperties.Compression compression = chatProperties.getCompression();
        LocalDateTime now = LocalDateTime.now();
        List<ChatMessage> ascending = chatMessageMapper.findByGroupAfterSeq(groupId, afterSeq,
                chatProperties.getHistory().getLoadLimit());
        List<ChatMessage> settled = settledPrefix(ascending, afterSeq,
                now.minus(compression.getInFlightStaleAfter()), now.minus(compression.getSequenceGapGrace()));
        if (settled.size() < ascending.size()) {
            log.debug("压缩范围在进行中的消息前截断 groupId={}, afterSeq={}, loaded={}, settled={}",
                    groupId, afterSeq, ascending.size(), settled.size());
        }
        return settled.stream()
                .filter(ChatMessageServiceImpl::usableAsContext)
                .collect(Collectors.toList());
    }

    @Override
    public List<ChatMessage> loadSessionHistory(String sessionId, String excludeRunId, int limit) {
        List<ChatMessage> desc = chatMessageMapper.findBySessionDesc(sessionId, Math.max(1, limit));
        List<ChatMessage> asc = new ArrayList<>(desc);
        Collections.reverse(asc);
        return asc.stream()
                .filter(m -> excludeRunId == null || !Objects.equals(excludeRunId, m.getRunId()))
                .filter(ChatMessageServiceImpl::usableAsContext)
                .collect(Collectors.toList());
    }

    private List<ChatMessage> loadRecentWindow(String groupId, ChatProperties.History history) {
        Optional<List<ChatMessage>> cached = recentMessageCache.get(groupId);
        if (cached.isPresent()) {
            return cached.get();
        }
        String generation = recentMessageCache.generation(groupId);
        List<ChatMessage> window = new ArrayList<>(
                chatMessageMapper.findByGroupDesc(groupId, null, history.getRecentCacheSize()));
        Collections.reverse(window);
        recentMessageCache.fillIfUnchanged(groupId, generation, window, history.getRecentCacheTtl());
        return window;
    }

    /**
     * 窗口未满说明包含了群的全部消息；窗口已满时，只有最早序号不晚于 afterSeq+1 才能保证没有遗漏
     */
    static boolean windowCovers(List<ChatMessage> window, long afterSeq, int windowSize) {
        if (window.size() < windowSize) {
            return true;
        }
        Long firstSeq = window.get(0).getGroupSeq();
        return firstSeq != null && firstSeq <= afterSeq + 1;
    }

    /**
     * 升序消息中已经落定的连续前缀。
     * 遇到 streamingSince 之后仍有写入的 STREAMING 消息，或序号空位后紧跟一条 gapSince 之后创建的消息时截断；
     * 更早的 STREAMING 行与空位视为已放弃，不再阻塞压缩。
     */
    static List<ChatMessage> settledPrefix(List<ChatMessage> ascending, long afterSeq,
                                           LocalDateTime streamingSince, LocalDateTime gapSince) {
        List<ChatMessage> prefix = new ArrayList<>();
        long expectedSeq = afterSeq + 1;
        for (ChatMessage message : ascending) {
            Long seq = message.getGroupSeq();
            if (seq == null || seq <= afterSeq) {
                continue;
            }
            if (seq > expectedSeq && message.getTimestamp() != null && message.getTimestamp().isAfter(gapSince)) {
                break;
            }
            LocalDateTime touchedAt = message.getUpdatedAt() != null ? message.getUpdatedAt() : message.getTimestamp();
            if (message.getStatus() == MessageStatus.STREAMING && (touchedAt == null || touchedAt.isAfter(streamingSince))) {
                break;
            }
            prefix.add(message);
            expectedSeq = seq + 1;
        }
        return prefix;
    }

    private static boolean usableAsContext(ChatMessage message) {
        return message.getStatus() != MessageStatus.STREAMING
                && message.getStatus() != MessageStatus.FAILED
                && StringUtils.hasText(message.getContent());
    }
}
