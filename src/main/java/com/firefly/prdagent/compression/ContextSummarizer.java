package com.firefly.prdagent.compression;

import com.firefly.prdagent.ai.AIModelFactory;
import com.firefly.prdagent.ai.LlmChunk;
import com.firefly.prdagent.ai.LlmMessage;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.config.ChatProperties;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.entity.MessageRole;
import com.firefly.prdagent.exception.ChatErrorCode;
import com.firefly.prdagent.exception.ChatException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 群对话摘要生成。
 * <p>
 * 一次模型调用把待压缩的消息（连同已有摘要）折叠为新的检查点文本；
 * 调用失败或输出为空时返回 {@code Optional.empty()}，压缩失败不影响对话本身。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextSummarizer {

    static final String SUMMARY_INSTRUCTION = "你是PRD协作群的对话记录压缩助手，需要把较早的群聊记录压缩成供后续对话使用的上下文摘要。\n"
            + "请严格遵循以下要求：\n"
            + "- 保留与当前讨论目标相关的事实、已确定的决定、约束条件以及尚未解决的问题。\n"
            + "- 删除寒暄、重复表述和与需求无关的闲聊。\n"
            + "- 不得编造记录中不存在的信息；不确定的内容标注为待确认。\n"
            + "- 如提供了已有摘要，请与新记录合并为一份完整摘要，不要丢失已有摘要中的要点。\n"
            + "- PRD原文不在输入中，不要复述或猜测文档内容。\n"
            + "- 使用简体中文，按要点分条输出，只输出摘要正文。";

    private final AIModelFactory modelFactory;
    private final RetryTemplate summaryRetryTemplate;
    private final ChatProperties chatProperties;

    /**
     * @param groupId         群ID
     * @param toCompress      待压缩的消息，按 groupSeq 升序，不能为空
     * @param previous        当前有效的检查点，可为 null
     * @param currentUserHint 触发压缩的用户提问，仅用于判断相关性
     */
    public Optional<GroupCompressionState> summarize(String groupId,
                                                     List<ChatMessage> toCompress,
                                                     GroupCompressionState previous,
                                                     String currentUserHint) {
        if (toCompress == null || toCompress.isEmpty()) {
            return Optional.empty();
        }
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SUMMARY_INSTRUCTION)
                .message(LlmMessage.user(buildTranscript(toCompress, previous, currentUserHint)))
                .purpose(LlmRequest.LlmPurpose.COMPRESSION)
                .groupId(groupId)
                .build();

        String summary;
        try {
            summary = summaryRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("重试生成上下文摘要 groupId={}, attempt={}", groupId, context.getRetryCount() + 1);
                }
                return invoke(request);
            });
        } catch (Exception e) {
            log.warn("上下文摘要生成失败，本次跳过压缩 groupId={}: {}", groupId, e.getMessage());
            return Optional.empty();
        }
        if (!StringUtils.hasText(summary)) {
            log.warn("上下文摘要为空，本次跳过压缩 groupId={}", groupId);
            return Optional.empty();
        }

        ChatMessage first = toCompress.get(0);
        ChatMessage last = toCompress.get(toCompress.size() - 1);
        int originalChars = toCompress.stream().mapToInt(ChatMessage::contentLength).sum();
        if (previous != null && previous.getOriginalChars() != null) {
            originalChars += previous.getOriginalChars();
        }
        Long fromSeq = previous != null && previous.getFromSeq() != null ? previous.getFromSeq() : first.getGroupSeq();

        GroupCompressionState state = GroupCompressionState.builder()
                .groupId(groupId)
                .fromSeq(fromSeq)
                .toSeq(last.getGroupSeq())
                .compressedText(summary)
                .originalChars(originalChars)
                .compressedChars(summary.length())
                .createdAt(LocalDateTime.now())
                .build();
        log.info("生成上下文摘要 groupId={}, range=[{}, {}], originalChars={}, compressedChars={}",
                groupId, state.getFromSeq(), state.getToSeq(), state.getOriginalChars(), state.getCompressedChars());
        return Optional.of(state);
    }

    private String invoke(LlmRequest request) {
        List<LlmChunk> chunks = modelFactory.getSummaryModel()
                .streamGenerate(request)
                .collectList()
                .block(chatProperties.getCompression().getSummaryTimeout());
        StringBuilder sb = new StringBuilder();
        if (chunks != null) {
            for (LlmChunk chunk : chunks) {
                if (chunk.type() == LlmChunk.Type.ERROR) {
                    throw new ChatException(ChatErrorCode.LLM_ERROR, chunk.errorMessage());
                }
                if (chunk.hasText()) {
                    sb.append(chunk.content());
                }
            }
        }
        return sb.toString().trim();
    }

    static String buildTranscript(List<ChatMessage> toCompress, GroupCompressionState previous, String currentUserHint) {
        StringBuilder sb = new StringBuilder();
        if (previous != null && StringUtils.hasText(previous.getCompressedText())) {
            sb.append("[已有摘要，覆盖序号 ").append(previous.getFromSeq()).append(" - ").append(previous.getToSeq()).append("]\n");
            sb.append(previous.getCompressedText().trim()).append("\n\n");
        }
        sb.append("[待压缩的群聊记录]\n");
        for (ChatMessage m : toCompress) {
            sb.append('#').append(m.getGroupSeq()).append(' ');
            if (m.getRole() == MessageRole.ASSISTANT) {
                sb.append("助手");
                if (m.getAnswerAsRole() != null) {
                    sb.append('(').append(m.getAnswerAsRole().name()).append(')');
                }
            } else {
                sb.append("用户");
                if (m.getSenderUserId() != null) {
                    sb.append('(').append(m.getSenderUserId()).append(')');
                }
            }
            sb.append(": ").append(m.getContent() != null ? m.getContent().trim() : "").append('\n');
        }
        if (StringUtils.hasText(currentUserHint)) {
            sb.append("\n[当前提问，仅用于判断哪些内容相关]\n").append(currentUserHint.trim()).append('\n');
        }
        return sb.toString();
    }
}
