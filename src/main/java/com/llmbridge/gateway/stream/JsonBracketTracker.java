package com.llmbridge.gateway.stream;

/**
 * JSON 括号平衡跟踪，跳过字符串内的括号与转义
 */
public class JsonBracketTracker {

    private int depth;
    private boolean inString;
    private boolean escaped;
    private boolean started;

    /**
     * 输入一个字符（或 ASCII 字节）
     *
     * @return 该字符是否恰好闭合了最外层的对象或数组
     */
    public boolean accept(int ch) {
        if (inString) {
            if (escaped) {
                escaped = false;
            } else if (ch == '\\') {
                escaped = true;
            } else if (ch == '"') {
                inString = false;
            }
            return false;
        }
        switch (ch) {
            case '"' -> inString = depth > 0;
            case '{', '[' -> {
                depth++;
                started = true;
            }
            case '}', ']' -> {
                if (depth > 0) {
                    depth--;
                    return depth == 0;
                }
            }
            default -> {
            }
        }
        return false;
    }

    public void accept(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            accept(text.charAt(i));
        }
    }

    public boolean isInside() {
        return depth > 0;
    }

    public boolean isComplete() {
        return started && depth == 0 && !inString;
    }
}
