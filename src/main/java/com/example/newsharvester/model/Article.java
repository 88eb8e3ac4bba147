/**
 * Article 클래스는 수집된 뉴스 기사의 도메인 모델을 나타냅니다.
 * - 기사 URL(url), 제목(title), 정제된 본문(text), 소속 카테고리 목록(categories),
 *   원격 게시물 ID(sourceId) 및 수집 시각(harvestedAt, UTC)을 보유합니다.
 * - 불변 객체(immutable)로 설계되어 한 번 생성되면 필드 값이 변경되지 않습니다.
 * - equals()와 hashCode()는 기사의 고유 식별자(url)를 기준으로 동등성을 판단합니다.
 */

package com.example.newsharvester.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

public class Article {
    private final String url;
    private final String title;
    private final String text;
    private final List<String> categories;
    private final Long sourceId;
    private final Instant harvestedAt;

    public Article(String url, String title, String text, Collection<String> categories,
                   Long sourceId, Instant harvestedAt) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Article url must not be empty");
        }
        this.url = url;
        this.title = title == null ? "" : title;
        this.text = text == null ? "" : text;
        // 중복 카테고리는 처음 나온 순서를 유지한 채 제거합니다.
        this.categories = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(categories)));
        this.sourceId = sourceId;
        this.harvestedAt = harvestedAt;
    }

    public String getUrl() {
        return url;
    }
    public String getTitle() {
        return title;
    }
    public String getText() {
        return text;
    }
    public List<String> getCategories() {
        return categories;
    }
    public Long getSourceId() {
        return sourceId;
    }
    public Instant getHarvestedAt() {
        return harvestedAt;
    }

    /**
     * 주어진 카테고리들을 기존 목록 뒤에 합친 새 Article을 반환합니다.
     * 추가할 카테고리가 없으면 자기 자신을 반환합니다.
     */
    public Article withCategories(Collection<String> more) {
        if (categories.containsAll(more)) {
            return this;
        }
        List<String> union = new ArrayList<>(categories);
        union.addAll(more);
        return new Article(url, title, text, union, sourceId, harvestedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Article article = (Article) o;
        return Objects.equals(url, article.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return "Article{url='" + url + "', title='" + title + "', categories=" + categories + "}";
    }
}
