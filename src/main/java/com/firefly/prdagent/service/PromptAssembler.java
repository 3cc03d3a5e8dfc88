package com.firefly.prdagent.service;

import com.firefly.prdagent.ai.LlmMessage;
import com.firefly.prdagent.ai.LlmRequest;
import com.firefly.prdagent.entity.AnswerRole;
import com.firefly.prdagent.entity.ChatMessage;
import com.firefly.prdagent.entity.GroupCompressionState;
import com.firefly.prdagent.entity.MessageRole;
import com.firefly.prdagent.entity.PrdDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 组装模型输入。
 * <p>
 * 上下文按固定顺序排列：PRD原文、压缩摘要（标注为整理材料）、检查点之后的原始历史、本轮提问。
 * 系统提示词附加回答视角（PM / DEV / QA）的要求。
 */
@Component
public class PromptAssembler {

    static final String DOCUMENT_LABEL = "[PRD文档原文]";
    static final String SUMMARY_LABEL = "[早期群聊摘要，由系统整理，仅作背景参考；与PRD原文冲突时以原文为准]";

    public LlmRequest assemble(ChatTurnContext context,
                               PrdDocument document,
                               Optional<GroupCompressionState> checkpoint,
                               List<ChatMessage> history,
                               String userContent) {
        List<ContextSegment> segments = segments(context, document, checkpoint, history, userContent);
        return LlmRequest.builder()
                .systemPrompt(buildSystemPrompt(context.answerAsRole(), document))
                .messages(segments.stream().map(ContextSegment::toMessage).collect(Collectors.toList()))
                .purpose(LlmRequest.LlmPurpose.CHAT)
                .runId(context.runId())
                .groupId(context.groupId())
                .sessionId(context.sessionId())
                .build();
    }

    public List<ContextSegment> segments(ChatTurnContext context,
                                         PrdDocument document,
                                         Optional<GroupCompressionState> checkpoint,
                                         List<ChatMessage> history,
                                         String userContent) {
        List<ContextSegment> segments = new ArrayList<>();
        if (document != null && StringUtils.hasText(document.getRawContent())) {
            String title = StringUtils.hasText(document.getTitle()) ? "《" + document.getTitle() + "》\n" : "";
            segments.add(new ContextSegment(ContextSegment.Kind.DOCUMENT, LlmMessage.Role.USER,
                    DOCUMENT_LABEL + "\n" + title + document.getRawContent()));
        }
        checkpoint.filter(c -> StringUtils.hasText(c.getCompressedText()))
                .ifPresent(c -> segments.add(new ContextSegment(ContextSegment.Kind.COMPRESSED_SUMMARY, LlmMessage.Role.USER,
                        SUMMARY_LABEL + "\n" + c.getCompressedText())));

        Long coveredTo = checkpoint.map(GroupCompressionState::getToSeq).orElse(null);
        if (history != null) {
            for (ChatMessage m : history) {
                if (coveredTo != null && m.getGroupSeq() != null && m.getGroupSeq() <= coveredTo) {
                    continue;
                }
                segments.add(historySegment(m, context.isGroupTurn()));
            }
        }
        segments.add(new ContextSegment(ContextSegment.Kind.NEW_TURN, LlmMessage.Role.USER,
                context.isGroupTurn() ? speakerPrefix(context.userId()) + userContent : userContent));
        return segments;
    }

    private ContextSegment historySegment(ChatMessage m, boolean groupTurn) {
        if (m.getRole() == MessageRole.ASSISTANT) {
            return new ContextSegment(ContextSegment.Kind.HISTORY, LlmMessage.Role.ASSISTANT, m.getContent());
        }
        // 群聊有多位发言人，需要标注说话人
        String content = groupTurn ? speakerPrefix(m.getSenderUserId()) + m.getContent() : m.getContent();
        return new ContextSegment(ContextSegment.Kind.HISTORY, LlmMessage.Role.USER, content);
    }

    private static String speakerPrefix(String userId) {
        return "[" + (userId != null ? userId : "成员") + "] ";
    }

    String buildSystemPrompt(AnswerRole role, PrdDocument document) {
        return "你是PRD协作平台的需求分析助手，和团队成员一起围绕给定的PRD文档讨论需求。\n\n"
                + "请严格遵循以下要求：\n"
                + roleDirective(role)
                + "- 依据：回答以PRD原文为准；文档中没有的信息要明确说明，不要编造。\n"
                + "- 引用：提到文档内容时使用原文中的章节标题，便于定位。\n"
                + "- 群聊：多人发言时以方括号标注说话人，回答最后一条提问即可。\n"
                + "- 格式规范：严格使用 Markdown；代码块以 ``` 加语言名开头。\n"
                + "- 回答语言：使用简体中文。";
    }

    static String roleDirective(AnswerRole role) {
        if (role == null) {
            role = AnswerRole.PM;
        }
        switch (role) {
            case DEV:
                return "- 回答视角：开发工程师。关注技术方案、接口与数据设计、实现风险和工作量评估。\n";
            case QA:
                return "- 回答视角：测试工程师。关注验收标准、测试场景、边界条件和异常路径。\n";
            case PM:
            default:
                return "- 回答视角：产品经理。关注业务目标、用户场景、需求边界和优先级。\n";
        }
    }
}
