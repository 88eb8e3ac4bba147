package com.example.newsharvester.model;

public class SearchHit {
    private final String category;
    private final Article article;

    public SearchHit(String category, Article article) {
        this.category = category;
        this.article = article;
    }

    public String getCategory() {
        return category;
    }
    public Article getArticle() {
        return article;
    }
}
