package com.lexintel.service.analyze;

import com.lexintel.core.model.Article;

import java.util.List;

public interface HistoricalContextProvider {
    String contextFor(List<Article> batch);

    static HistoricalContextProvider none() {
        return batch -> "";
    }
}
