package com.example.newsharvester.model;

import java.util.List;

public class MergeResult {
    private final List<Article> articles;
    private final List<SourceStats> sourceStats;
    private final int duplicateCount;

    public MergeResult(List<Article> articles, List<SourceStats> sourceStats, int duplicateCount) {
        this.articles = List.copyOf(articles);
        this.sourceStats = List.copyOf(sourceStats);
        this.duplicateCount = duplicateCount;
    }

    public List<Article> getArticles() {
        return articles;
    }
    public List<SourceStats> getSourceStats() {
        return sourceStats;
    }
    public int getDuplicateCount() {
        return duplicateCount;
    }
}
