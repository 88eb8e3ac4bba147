package com.example.newsharvester.model;

import java.util.List;

public class RunSummary {
    private final int totalAdded;
    private final int totalArticles;
    private final List<String> harvestedCategories;
    private final List<String> failedCategories;

    public RunSummary(int totalAdded, int totalArticles, List<String> harvestedCategories, List<String> failedCategories) {
        this.totalAdded = totalAdded;
        this.totalArticles = totalArticles;
        this.harvestedCategories = List.copyOf(harvestedCategories);
        this.failedCategories = List.copyOf(failedCategories);
    }

    public int getTotalAdded() {
        return totalAdded;
    }
    public int getTotalArticles() {
        return totalArticles;
    }
    public List<String> getHarvestedCategories() {
        return harvestedCategories;
    }
    public List<String> getFailedCategories() {
        return failedCategories;
    }
}
