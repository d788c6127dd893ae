package com.lexintel.service.signals;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.CategoryMomentum;
import com.lexintel.core.model.MomentumDirection;
import com.lexintel.service.store.ArticleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MomentumCalculator {
    public static final int MAX_DAYS = 30;
    static final double BAND_PCT = 10.0;

    private final ArticleStore articleStore;
    private final Clock clock;

    public MomentumCalculator(ArticleStore articleStore, Clock clock) {
        this.articleStore = articleStore;
        this.clock = clock;
    }

    public static int clampDays(int days) {
        return Math.max(1, Math.min(days, MAX_DAYS));
    }

    public List<CategoryMomentum> momentum(int days) {
        Duration window = Duration.ofDays(clampDays(days));
        Instant now = clock.instant();
        Instant currentStart = now.minus(window);
        Instant previousStart = currentStart.minus(window);

        Map<Category, Integer> current = new EnumMap<>(Category.class);
        Map<Category, Integer> previous = new EnumMap<>(Category.class);
        for (Article article : articleStore.scrapedSince(previousStart)) {
            if (article.category() == null || article.scrapedAt().isAfter(now)) {
                continue;
            }
            Map<Category, Integer> bucket = article.scrapedAt().isBefore(currentStart) ? previous : current;
            bucket.merge(article.category(), 1, Integer::sum);
        }

        List<CategoryMomentum> result = new ArrayList<>();
        for (Category category : Category.values()) {
            result.add(classify(category, current.getOrDefault(category, 0), previous.getOrDefault(category, 0)));
        }
        result.sort(Comparator.comparingInt(CategoryMomentum::current).reversed());
        return result;
    }

    /**
     * A category with no prior volume and some current volume counts as a 100% rise.
     */
    public static CategoryMomentum classify(Category category, int current, int previous) {
        double rawPct;
        if (previous > 0) {
            rawPct = 100.0 * (current - previous) / previous;
        } else {
            rawPct = current > 0 ? 100.0 : 0.0;
        }
        // band on the unrounded change; only the reported figure is rounded
        MomentumDirection direction;
        if (rawPct > BAND_PCT) {
            direction = MomentumDirection.RISING;
        } else if (rawPct < -BAND_PCT) {
            direction = MomentumDirection.DECLINING;
        } else {
            direction = MomentumDirection.STABLE;
        }
        return new CategoryMomentum(category, current, previous, Math.round(rawPct * 10.0) / 10.0, direction);
    }
}
