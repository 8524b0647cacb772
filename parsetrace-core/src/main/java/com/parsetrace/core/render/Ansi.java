package com.parsetrace.core.render;

/**
 * ANSI 终端转义码
 */
public final class Ansi {

    public static final String FG_RED = "\u001b[31m";
    public static final String FG_GREEN = "\u001b[32m";
    public static final String FG_YELLOW = "\u001b[33m";
    public static final String FG_MAGENTA = "\u001b[35m";
    public static final String FG_WHITE = "\u001b[37m";

    public static final String BG_CYAN = "\u001b[46m";
    public static final String BG_BRIGHT_BLUE = "\u001b[104m";

    public static final String RESET = "\u001b[0m";

    private Ansi() {
    }

    public static String paint(String code, String text) {
        return code + text + RESET;
    }

    /**
     * 去掉所有转义序列
     */
    public static String strip(String text) {
        return text.replaceAll("\u001b\\[[0-9;]*m", "");
    }
}
