package com.parsetrace.core.util;

import java.util.Arrays;

/**
 * 载荷格式化
 * 字符串加引号并转义，数组展开，其余走 toString。
 */
public final class ValueFormatter {

    private static final String ELLIPSIS = "...";

    private ValueFormatter() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return quote(value.toString());
        }
        if (value instanceof Character) {
            return "'" + escape(value.toString()) + "'";
        }
        if (value.getClass().isArray()) {
            // 包一层 Object[]，基本类型数组也能走 deepToString
            return Arrays.deepToString(new Object[]{value})
                    .substring(1)
                    .replaceFirst("]$", "");
        }
        return value.toString();
    }

    /**
     * 输入快照
     *
     * @param maxLength 0 表示不截断
     */
    public static String snapshot(Object input, int maxLength) {
        String text = String.valueOf(input);
        if (maxLength > 0 && text.length() > maxLength) {
            int end = Character.isHighSurrogate(text.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
            return text.substring(0, end) + ELLIPSIS;
        }
        return text;
    }

    private static String quote(String s) {
        return "\"" + escape(s) + "\"";
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
