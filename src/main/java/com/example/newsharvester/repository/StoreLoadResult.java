package com.example.newsharvester.repository;

import com.example.newsharvester.model.Article;

import java.util.Collections;
import java.util.List;

/**
 * 카테고리 파일 읽기 결과. 파일이 없을 때(NOT_FOUND)와 읽을 수 없을 때(PARSE_ERROR)를 구분합니다.
 * 두 경우 모두 articles는 빈 목록입니다.
 */
public final class StoreLoadResult {
    public enum Status {
        LOADED,
        NOT_FOUND,
        PARSE_ERROR
    }

    private final Status status;
    private final List<Article> articles;
    private final int skippedEntries;
    private final String error;

    private StoreLoadResult(Status status, List<Article> articles, int skippedEntries, String error) {
        this.status = status;
        this.articles = articles;
        this.skippedEntries = skippedEntries;
        this.error = error;
    }

    public static StoreLoadResult loaded(List<Article> articles, int skippedEntries) {
        return new StoreLoadResult(Status.LOADED, List.copyOf(articles), skippedEntries, null);
    }

    public static StoreLoadResult notFound() {
        return new StoreLoadResult(Status.NOT_FOUND, Collections.emptyList(), 0, null);
    }

    public static StoreLoadResult parseError(String error) {
        return new StoreLoadResult(Status.PARSE_ERROR, Collections.emptyList(), 0, error);
    }

    public Status getStatus() {
        return status;
    }
    public List<Article> getArticles() {
        return articles;
    }
    public int getSkippedEntries() {
        return skippedEntries;
    }
    public String getError() {
        return error;
    }
}
