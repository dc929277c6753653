package com.llmbridge.gateway.stream;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内嵌推理标签解析器
 * <p>
 * 部分后端把推理过程以 &lt;think&gt; 或 &lt;thinking&gt; 标签写在正文里；
 * 逐片段拆出推理内容与正文，末尾可能是半个标签时先保留，待下个片段到达再判断
 */
public class ThinkingTagParser {

    private static final Pattern OPEN_TAG = Pattern.compile("<(think|thinking)>", Pattern.CASE_INSENSITIVE);
    // 最长的开始标签，用于判断半截标签
    private static final String LONGEST_OPEN = "<thinking>";

    private boolean inThinking = false;
    private String closeTag;
    private final StringBuilder pendingBuffer = new StringBuilder();

    /**
     * 输入流式文本片段，返回解析结果
     */
    public ParseResult feed(String text) {
        if (text == null || text.isEmpty()) {
            return ParseResult.EMPTY;
        }

        pendingBuffer.append(text);
        String pending = pendingBuffer.toString();
        pendingBuffer.setLength(0);

        StringBuilder thinking = new StringBuilder();
        StringBuilder content = new StringBuilder();

        while (!pending.isEmpty()) {
            if (inThinking) {
                int end = indexOfIgnoreCase(pending, closeTag);
                if (end >= 0) {
                    thinking.append(pending, 0, end);
                    pending = pending.substring(end + closeTag.length());
                    inThinking = false;
                    continue;
                }
                int safeEnd = findSafeEnd(pending, closeTag);
                thinking.append(pending, 0, safeEnd);
                pendingBuffer.append(pending.substring(safeEnd));
                break;
            }

            Matcher matcher = OPEN_TAG.matcher(pending);
            if (matcher.find()) {
                content.append(pending, 0, matcher.start());
                closeTag = "</" + matcher.group(1) + ">";
                pending = pending.substring(matcher.end());
                inThinking = true;
                continue;
            }
            int safeEnd = findSafeEnd(pending, LONGEST_OPEN);
            content.append(pending, 0, safeEnd);
            pendingBuffer.append(pending.substring(safeEnd));
            break;
        }

        return new ParseResult(thinking.isEmpty() ? null : thinking.toString(),
                content.isEmpty() ? null : content.toString());
    }

    /**
     * 完成解析，flush 剩余内容
     */
    public ParseResult finish() {
        String remaining = pendingBuffer.toString();
        pendingBuffer.setLength(0);

        if (remaining.isEmpty()) {
            return ParseResult.EMPTY;
        }
        return inThinking ? new ParseResult(remaining, null) : new ParseResult(null, remaining);
    }

    /**
     * 在原串上逐位比较，大小写转换可能改变长度，不能先转小写再取下标
     */
    private static int indexOfIgnoreCase(String text, String tag) {
        for (int i = 0; i + tag.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, tag, 0, tag.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 查找安全截断位置，避免截断可能的标签前缀
     */
    private static int findSafeEnd(String text, String tag) {
        for (int suffixLen = Math.min(text.length(), tag.length() - 1); suffixLen >= 1; suffixLen--) {
            String suffix = text.substring(text.length() - suffixLen);
            if (tag.substring(0, suffixLen).equalsIgnoreCase(suffix)) {
                return text.length() - suffixLen;
            }
        }
        return text.length();
    }

    /**
     * 解析结果
     */
    public record ParseResult(String thinkingDelta, String contentDelta) {
        public static final ParseResult EMPTY = new ParseResult(null, null);

        public boolean hasThinking() { return thinkingDelta != null && !thinkingDelta.isEmpty(); }
        public boolean hasContent() { return contentDelta != null && !contentDelta.isEmpty(); }
    }
}
