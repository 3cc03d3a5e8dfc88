package com.firefly.prdagent.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 将流式文本按“块”切分，便于客户端稳定渲染（块协议）。
 * <ul>
 *     <li>以“行”为最小解析粒度：收到换行后再判定块类型，避免 token 级别抖动与误判</li>
 *     <li>支持 paragraph / heading / listItem / codeBlock</li>
 *     <li>codeBlock 使用 ``` 围栏，语言从开围栏行解析</li>
 * </ul>
 * 每轮对话一个实例，非线程安全。
 */
public class MarkdownBlockTokenizer {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+.+$");
    private static final Pattern BULLET = Pattern.compile("^([-*+])\\s+.+$");
    private static final Pattern ORDERED = Pattern.compile("^\\d+\\.\\s+.+$");
    private static final String FENCE = "```";

    private final StringBuilder lineBuffer = new StringBuilder();

    private boolean inCodeBlock;
    private String openParagraphId;
    private String openCodeBlockId;
    private String openCodeLanguage;

    public List<BlockToken> push(String delta) {
        List<BlockToken> out = new ArrayList<>();
        if (delta == null || delta.isEmpty()) {
            return out;
        }
        lineBuffer.append(delta);
        int nl;
        while ((nl = lineBuffer.indexOf("\n")) >= 0) {
            String line = stripCarriageReturn(lineBuffer.substring(0, nl));
            lineBuffer.delete(0, nl + 1);
            processLine(line, out);
        }
        return out;
    }

    /**
     * 上游流可能在块中途结束：处理残留半行并关闭所有未结束的块。
     */
    public List<BlockToken> flush() {
        List<BlockToken> out = new ArrayList<>();
        if (lineBuffer.length() > 0) {
            String line = stripCarriageReturn(lineBuffer.toString());
            lineBuffer.setLength(0);
            processLine(line, out);
        }
        if (inCodeBlock && openCodeBlockId != null) {
            out.add(BlockToken.end(openCodeBlockId, BlockKind.CODE_BLOCK, openCodeLanguage));
            closeCodeBlock();
        }
        closeParagraph(out);
        return out;
    }

    public boolean hasOpenBlock() {
        return inCodeBlock || openParagraphId != null;
    }

    private void processLine(String line, List<BlockToken> out) {
        // 围栏内优先级最高：内容原样输出，不做任何块判定
        if (inCodeBlock) {
            if (isFence(line)) {
                out.add(BlockToken.end(openCodeBlockId, BlockKind.CODE_BLOCK, openCodeLanguage));
                closeCodeBlock();
                return;
            }
            out.add(BlockToken.delta(openCodeBlockId, BlockKind.CODE_BLOCK, line + "\n", openCodeLanguage));
            return;
        }

        if (line.isBlank()) {
            closeParagraph(out);
            return;
        }

        boolean singleLineBlock = isHeading(line) || isListItem(line);
        if (isFence(line) || singleLineBlock) {
            closeParagraph(out);
        }

        if (isFence(line)) {
            inCodeBlock = true;
            openCodeLanguage = parseFenceLanguage(line);
            openCodeBlockId = newId();
            out.add(BlockToken.start(openCodeBlockId, BlockKind.CODE_BLOCK, openCodeLanguage));
            return;
        }

        if (singleLineBlock) {
            BlockKind kind = isHeading(line) ? BlockKind.HEADING : BlockKind.LIST_ITEM;
            String id = newId();
            out.add(BlockToken.start(id, kind, null));
            out.add(BlockToken.delta(id, kind, line + "\n", null));
            out.add(BlockToken.end(id, kind, null));
            return;
        }

        if (openParagraphId == null) {
            openParagraphId = newId();
            out.add(BlockToken.start(openParagraphId, BlockKind.PARAGRAPH, null));
        }
        out.add(BlockToken.delta(openParagraphId, BlockKind.PARAGRAPH, line + "\n", null));
    }

    private void closeParagraph(List<BlockToken> out) {
        if (openParagraphId != null) {
            out.add(BlockToken.end(openParagraphId, BlockKind.PARAGRAPH, null));
            openParagraphId = null;
        }
    }

    private void closeCodeBlock() {
        inCodeBlock = false;
        openCodeBlockId = null;
        openCodeLanguage = null;
    }

    private static boolean isFence(String line) {
        return line.startsWith(FENCE);
    }

    private static boolean isHeading(String line) {
        return HEADING.matcher(line).matches();
    }

    private static boolean isListItem(String line) {
        return BULLET.matcher(line).matches() || ORDERED.matcher(line).matches();
    }

    private static String parseFenceLanguage(String fenceLine) {
        if (fenceLine.length() <= FENCE.length()) {
            return null;
        }
        String lang = fenceLine.substring(FENCE.length()).trim();
        return lang.isEmpty() ? null : lang;
    }

    private static String stripCarriageReturn(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
