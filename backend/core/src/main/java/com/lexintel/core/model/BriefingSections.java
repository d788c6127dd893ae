package com.lexintel.core.model;

import java.util.List;

public record BriefingSections(
        String lead,
        String patterns,
        String signals,
        List<String> watchlist,
        List<String> data
) {
    public BriefingSections {
        watchlist = watchlist == null ? List.of() : List.copyOf(watchlist);
        data = data == null ? List.of() : List.copyOf(data);
    }

    public String toMarkdown() {
        StringBuilder out = new StringBuilder();
        out.append("## LEAD\n\n").append(lead.trim()).append("\n\n");
        out.append("## PATTERNS\n\n").append(textOrNone(patterns)).append("\n\n");
        out.append("## SIGNALS\n\n").append(textOrNone(signals)).append("\n\n");
        out.append("## WATCHLIST\n\n").append(bullets(watchlist)).append("\n\n");
        out.append("## DATA\n\n").append(bullets(data)).append('\n');
        return out.toString();
    }

    private static String textOrNone(String text) {
        return text == null || text.isBlank() ? "_None today._" : text.trim();
    }

    private static String bullets(List<String> lines) {
        if (lines.isEmpty()) {
            return "_None today._";
        }
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("- ").append(line.trim());
        }
        return out.toString();
    }
}
