package com.lexintel.service.ingest;

import com.lexintel.core.model.Article;

public record DedupResult(DedupVerdict verdict, Article article, double similarity, String matchedArticle) {
    public boolean accepted() {
        return verdict == DedupVerdict.ACCEPTED;
    }

    public boolean unverified() {
        return accepted() && article.semanticUnverified();
    }
}
