package com.lexintel.core.util;

import java.util.regex.Pattern;

// Feed descriptions and summaries routinely carry markup. Bodies are stored as plain text.
public final class HtmlUtils {
    private static final Pattern BLOCK_PATTERN = Pattern.compile(
            "<(script|style)[^>]*>.*?</\\1>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern BREAK_PATTERN = Pattern.compile("<(br|/p|/div|/li)[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    private HtmlUtils() {
    }

    public static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = BLOCK_PATTERN.matcher(html).replaceAll(" ");
        text = BREAK_PATTERN.matcher(text).replaceAll("\n");
        text = TAG_PATTERN.matcher(text).replaceAll(" ");
        text = unescape(text);
        text = SPACES.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.lines().map(String::trim).reduce((a, b) -> a + "\n" + b).orElse("").trim();
    }

    private static String unescape(String text) {
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
