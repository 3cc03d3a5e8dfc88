package com.firefly.prdagent.citation;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * github-slugger 兼容的标题锚点生成器。
 * <p>
 * 结果依赖调用顺序（重复标题依次追加 -1、-2），同一篇文档必须从头使用一个新实例，
 * 才能与文档阅读器独立计算出的锚点保持一致。
 */
public class HeadingSlugger {

    static final String EMPTY_SLUG_FALLBACK = "section";

    private static final Pattern DASH_RUN = Pattern.compile("-+");

    private final Map<String, Integer> seen = new HashMap<>();

    public String slug(String value) {
        String base = baseSlug(value);
        if (base.isEmpty()) {
            base = EMPTY_SLUG_FALLBACK;
        }
        Integer count = seen.get(base);
        if (count == null) {
            seen.put(base, 0);
            return base;
        }
        count += 1;
        seen.put(base, count);
        return base + "-" + count;
    }

    public void reset() {
        seen.clear();
    }

    static String baseSlug(String value) {
        String s = value == null ? "" : value.trim();
        if (s.isEmpty()) {
            return "";
        }
        s = s.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            if (isSeparator(cp)) {
                sb.append('-');
            } else if (cp == '_' || isKept(cp)) {
                sb.appendCodePoint(cp);
            }
        });
        String collapsed = DASH_RUN.matcher(sb).replaceAll("-");
        return trimDashes(collapsed);
    }

    /**
     * 不换行空格（U+00A0、U+2007、U+202F）也按空白处理，与前端锚点一致
     */
    private static boolean isSeparator(int codePoint) {
        return codePoint == '-' || Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    private static boolean isKept(int codePoint) {
        switch (Character.getType(codePoint)) {
            case Character.UPPERCASE_LETTER:
            case Character.LOWERCASE_LETTER:
            case Character.TITLECASE_LETTER:
            case Character.MODIFIER_LETTER:
            case Character.OTHER_LETTER:
            case Character.DECIMAL_DIGIT_NUMBER:
            case Character.LETTER_NUMBER:
            case Character.NON_SPACING_MARK:
            case Character.COMBINING_SPACING_MARK:
                return true;
            default:
                return false;
        }
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
