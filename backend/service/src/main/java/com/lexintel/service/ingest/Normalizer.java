package com.lexintel.service.ingest;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.model.RawRecord;
import com.lexintel.core.util.HashingUtils;

import java.text.Normalizer.Form;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

public class Normalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;
    private final int maxBodyChars;
    private final int maxTitleChars;

    public Normalizer(Clock clock, int maxBodyChars, int maxTitleChars) {
        this.clock = clock;
        this.maxBodyChars = maxBodyChars;
        this.maxTitleChars = maxTitleChars;
    }

    // Empty when the title normalizes to nothing, which leaves nothing to dedup on.
    public Optional<Article> normalize(RawRecord record) {
        String title = truncate(record.title() == null ? "" : record.title().trim(), maxTitleChars);
        String titleNorm = normalizeTitle(title);
        if (titleNorm.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        String url = record.url() == null || record.url().isBlank() ? null : record.url().trim();
        String sourceId = record.sourceId() == null || record.sourceId().isBlank()
                ? HashingUtils.sourceId(record.source(), url != null ? url : title)
                : record.sourceId();
        return Optional.of(new Article(
                UUID.randomUUID().toString(),
                record.source(),
                sourceId,
                title,
                titleNorm,
                url,
                truncate(record.body() == null ? "" : record.body(), maxBodyChars),
                record.publishedAt() != null ? record.publishedAt() : now,
                now,
                null,
                null,
                null,
                ArticleStatus.PENDING,
                null,
                false
        ));
    }

    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String decomposed = java.text.Normalizer.normalize(title, Form.NFKD);
        String unmarked = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lowered = unmarked.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
