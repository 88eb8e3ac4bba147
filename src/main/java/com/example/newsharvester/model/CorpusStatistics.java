package com.example.newsharvester.model;

import java.time.Instant;
import java.util.Map;

/**
 * 저장된 코퍼스 전체에 대한 통계. 수집 시각이 하나도 없으면 earliest/latest는 null입니다.
 */
public class CorpusStatistics {
    private final int totalArticles;
    private final Map<String, Integer> categoryCounts;
    private final Instant earliest;
    private final Instant latest;

    public CorpusStatistics(int totalArticles, Map<String, Integer> categoryCounts, Instant earliest, Instant latest) {
        this.totalArticles = totalArticles;
        this.categoryCounts = Map.copyOf(categoryCounts);
        this.earliest = earliest;
        this.latest = latest;
    }

    public int getTotalArticles() {
        return totalArticles;
    }
    public int getTotalCategories() {
        return categoryCounts.size();
    }
    public Map<String, Integer> getCategoryCounts() {
        return categoryCounts;
    }
    public Instant getEarliest() {
        return earliest;
    }
    public Instant getLatest() {
        return latest;
    }
}
