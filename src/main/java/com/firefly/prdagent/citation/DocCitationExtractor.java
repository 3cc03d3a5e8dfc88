package com.firefly.prdagent.citation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 从 PRD 原文中提取回答的“引用依据”：章节 + 原文片段。
 * 目标是稳定给出 Top-N 依据，找不到依据时返回空列表而不是报错。
 */
@Component
@Slf4j
public class DocCitationExtractor {

    public static final int DEFAULT_MAX_CITATIONS = 12;
    private static final int MAX_CITATIONS_LIMIT = 50;

    private static final int MIN_RAW_PARAGRAPH_LENGTH = 12;
    private static final int MIN_CLEAN_PARAGRAPH_LENGTH = 18;
    private static final int MAX_KEYWORDS = 40;
    private static final int MAX_KEYWORD_LENGTH = 24;
    private static final int EXCERPT_LENGTH = 240;
    private static final int EXCERPT_LEAD = 40;
    private static final String ELLIPSIS = "…";

    private static final Pattern HEADING = Pattern.compile("^\\s*(#{1,6})\\s+(.+?)\\s*$");
    private static final Pattern FENCE_LINE = Pattern.compile("^\\s*(```+|~~~+)\\s*(\\w+)?\\s*$");
    private static final Pattern FENCED_BLOCK =
            Pattern.compile("(^|\\n)\\s*(```+|~~~+)[\\s\\S]*?(\\n\\s*\\2\\s*)(?=\\n|$)", Pattern.MULTILINE);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_HASHES = Pattern.compile("\\s+#+\\s*$");

    private static final Pattern CJK_RUN = Pattern.compile("[\\u4e00-\\u9fff]{2,}");
    private static final Pattern LATIN_RUN = Pattern.compile("[A-Za-z]{3,}");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d{3,}");

    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
    private static final Pattern QUOTE_MARKER = Pattern.compile("^\\s*>+\\s?", Pattern.MULTILINE);
    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*([-*+]|\\d+\\.)\\s+", Pattern.MULTILINE);
    private static final Pattern HEADING_MARKER = Pattern.compile("^\\s*#{1,6}\\s+", Pattern.MULTILINE);

    private record HeadingRow(String title, int lineIndex, String headingId) {
    }

    private record Candidate(String headingTitle, String headingId, String cleanText) {
    }

    private record Scored(Candidate candidate, double score) {
    }

    public List<DocCitation> extract(String documentRaw, String answerText) {
        return extract(documentRaw, answerText, DEFAULT_MAX_CITATIONS);
    }

    public List<DocCitation> extract(String documentRaw, String answerText, int maxCitations) {
        int limit = Math.max(0, Math.min(MAX_CITATIONS_LIMIT, maxCitations));
        if (limit == 0 || documentRaw == null || documentRaw.isBlank()) {
            return List.of();
        }
        String answer = normalizeWhitespace(answerText);
        if (answer.isEmpty()) {
            return List.of();
        }

        List<Candidate> candidates = buildCandidates(documentRaw);
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> keywords = extractKeywords(answer);
        if (keywords.isEmpty()) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            double s = score(c, keywords);
            if (s > 0) {
                scored.add(new Scored(c, s));
            }
        }
        if (scored.isEmpty()) {
            return List.of();
        }
        // List.sort 是稳定排序，同分时保持文档顺序
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        List<DocCitation> out = new ArrayList<>(limit);
        Set<String> seen = new HashSet<>();
        int rank = 1;
        for (Scored x : scored.subList(0, Math.min(scored.size(), limit * 3))) {
            if (out.size() >= limit) {
                break;
            }
            String excerpt = buildExcerpt(x.candidate().cleanText(), keywords);
            if (excerpt.isBlank()) {
                continue;
            }
            if (!seen.add(x.candidate().headingId() + "::" + normalizeWhitespace(excerpt))) {
                continue;
            }
            out.add(DocCitation.builder()
                    .headingTitle(x.candidate().headingTitle())
                    .headingId(x.candidate().headingId())
                    .excerpt(excerpt)
                    .score(Math.round(x.score() * 10000d) / 10000d)
                    .rank(rank++)
                    .build());
        }
        log.debug("引用抽取完成: candidates={}, keywords={}, citations={}", candidates.size(), keywords.size(), out.size());
        return out;
    }

    /**
     * 按文档顺序返回所有标题的锚点，算法与引用抽取使用的完全一致。
     */
    public List<String> headingIds(String documentRaw) {
        if (documentRaw == null || documentRaw.isBlank()) {
            return List.of();
        }
        return extractHeadings(splitLines(documentRaw)).stream().map(HeadingRow::headingId).collect(Collectors.toList());
    }

    private List<Candidate> buildCandidates(String rawMarkdown) {
        String[] lines = splitLines(rawMarkdown);
        List<HeadingRow> headings = extractHeadings(lines);
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < headings.size(); i++) {
            HeadingRow h = headings.get(i);
            int start = h.lineIndex() + 1;
            int end = i + 1 < headings.size() ? headings.get(i + 1).lineIndex() : lines.length;
            if (start >= lines.length || end <= start) {
                continue;
            }
            String body = String.join("\n", Arrays.copyOfRange(lines, start, end));
            for (String paragraph : splitParagraphs(body)) {
                if (paragraph.length() < MIN_RAW_PARAGRAPH_LENGTH) {
                    continue;
                }
                String clean = normalizeWhitespace(cleanMarkdown(paragraph));
                if (clean.length() < MIN_CLEAN_PARAGRAPH_LENGTH) {
                    continue;
                }
                candidates.add(new Candidate(h.title(), h.headingId(), clean));
            }
        }
        return candidates;
    }

    private List<HeadingRow> extractHeadings(String[] lines) {
        HeadingSlugger slugger = new HeadingSlugger();
        List<HeadingRow> rows = new ArrayList<>();
        boolean inFence = false;
        String fenceToken = null;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Matcher fence = FENCE_LINE.matcher(line);
            if (fence.matches()) {
                if (!inFence) {
                    inFence = true;
                    fenceToken = fence.group(1);
                } else if (fenceToken != null && line.stripLeading().startsWith(fenceToken)) {
                    inFence = false;
                    fenceToken = null;
                }
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher m = HEADING.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String title = normalizeHeadingText(m.group(2));
            if (title.isEmpty()) {
                continue;
            }
            rows.add(new HeadingRow(title, i, slugger.slug(title)));
        }
        return rows;
    }

    private static List<String> splitParagraphs(String markdown) {
        if (markdown.isBlank()) {
            return List.of();
        }
        String withoutFence = FENCED_BLOCK.matcher(markdown).replaceAll("\n");
        List<String> parts = new ArrayList<>();
        for (String p : PARAGRAPH_BREAK.split(withoutFence)) {
            String t = p.trim();
            if (!t.isEmpty()) {
                parts.add(t);
            }
        }
        return parts;
    }

    static Map<String, Integer> extractKeywords(String answer) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Pattern p : List.of(CJK_RUN, LATIN_RUN, DIGIT_RUN)) {
            Matcher m = p.matcher(answer);
            while (m.find()) {
                String token = m.group().toLowerCase(Locale.ROOT);
                if (token.length() > MAX_KEYWORD_LENGTH) {
                    token = token.substring(0, MAX_KEYWORD_LENGTH);
                }
                counts.merge(token, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Comparator.comparingInt((Map.Entry<String, Integer> e) ->
                e.getValue() * Math.min(8, e.getKey().length())).reversed());
        Map<String, Integer> top = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : ranked.subList(0, Math.min(MAX_KEYWORDS, ranked.size()))) {
            top.put(e.getKey(), e.getValue());
        }
        return top;
    }

    private static double score(Candidate c, Map<String, Integer> keywords) {
        String text = c.cleanText().toLowerCase(Locale.ROOT);
        double score = 0;
        for (String k : keywords.keySet()) {
            if (text.contains(k)) {
                // 长词权重更高，压低短词噪声
                score += Math.min(6, k.length());
            }
        }
        String title = c.headingTitle().toLowerCase(Locale.ROOT);
        for (String k : keywords.keySet()) {
            if (title.contains(k)) {
                score += 2.0;
            }
        }
        if (text.length() > 400) {
            score *= 0.9;
        }
        if (text.length() > 900) {
            score *= 0.85;
        }
        return score;
    }

    private static String buildExcerpt(String text, Map<String, Integer> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        int bestIdx = -1;
        int bestWeight = -1;
        for (Map.Entry<String, Integer> e : keywords.entrySet()) {
            int idx = lower.indexOf(e.getKey());
            if (idx < 0) {
                continue;
            }
            int weight = Math.min(10, e.getKey().length()) * 10 + Math.min(5, e.getValue());
            if (bestIdx < 0 || idx < bestIdx || (idx == bestIdx && weight > bestWeight)) {
                bestIdx = idx;
                bestWeight = weight;
            }
        }
        if (bestIdx < 0) {
            return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH) + ELLIPSIS;
        }
        int start = Math.max(0, bestIdx - EXCERPT_LEAD);
        int end = Math.min(text.length(), start + EXCERPT_LENGTH);
        String slice = text.substring(start, end);
        if (start > 0) {
            slice = ELLIPSIS + slice;
        }
        if (end < text.length()) {
            slice = slice + ELLIPSIS;
        }
        return slice;
    }

    private static String cleanMarkdown(String markdown) {
        String s = INLINE_CODE.matcher(markdown).replaceAll("$1");
        s = IMAGE.matcher(s).replaceAll("$1");
        s = LINK.matcher(s).replaceAll("$1");
        s = s.replace("**", "").replace("__", "").replace("*", "").replace("_", "");
        s = QUOTE_MARKER.matcher(s).replaceAll("");
        s = LIST_MARKER.matcher(s).replaceAll("");
        s = HEADING_MARKER.matcher(s).replaceAll("");
        return s.replace("|", " ");
    }

    private static String normalizeHeadingText(String raw) {
        String s = TRAILING_HASHES.matcher(raw == null ? "" : raw).replaceAll("").trim();
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    private static String normalizeWhitespace(String input) {
        if (input == null) {
            return "";
        }
        return WHITESPACE.matcher(input).replaceAll(" ").trim();
    }

    private static String[] splitLines(String raw) {
        return raw.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
    }
}
