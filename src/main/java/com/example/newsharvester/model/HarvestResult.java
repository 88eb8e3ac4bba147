package com.example.newsharvester.model;

import java.util.List;

/**
 * 한 카테고리 수집 결과: 기존 기사 뒤에 새 기사를 붙인 전체 목록과 새로 추가된 개수.
 */
public class HarvestResult {
    private final String category;
    private final List<Article> articles;
    private final int newCount;
    private final StopReason stopReason;
    private final int lastPage;

    public HarvestResult(String category, List<Article> articles, int newCount, StopReason stopReason, int lastPage) {
        this.category = category;
        this.articles = List.copyOf(articles);
        this.newCount = newCount;
        this.stopReason = stopReason;
        this.lastPage = lastPage;
    }

    public String getCategory() {
        return category;
    }
    public List<Article> getArticles() {
        return articles;
    }
    public int getNewCount() {
        return newCount;
    }
    public StopReason getStopReason() {
        return stopReason;
    }
    public int getLastPage() {
        return lastPage;
    }
}
