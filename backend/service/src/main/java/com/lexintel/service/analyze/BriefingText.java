package com.lexintel.service.analyze;

public final class BriefingText {
    public static final int MAX_LEAD_CHARS = 500;

    private BriefingText() {
    }

    public static String leadParagraph(String briefingText) {
        if (briefingText == null || briefingText.isBlank()) {
            return null;
        }
        for (String paragraph : briefingText.split("\n\\s*\n")) {
            String trimmed = paragraph.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return cap(trimmed);
            }
        }
        return cap(briefingText.strip());
    }

    private static String cap(String text) {
        return text.length() <= MAX_LEAD_CHARS ? text : text.substring(0, MAX_LEAD_CHARS);
    }
}
