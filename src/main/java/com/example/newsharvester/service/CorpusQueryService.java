package com.example.newsharvester.service;

import com.example.newsharvester.model.Article;
import com.example.newsharvester.model.CorpusStatistics;
import com.example.newsharvester.model.SearchHit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 저장된 코퍼스에 대한 간단한 조회: 키워드 검색, 수집 시각 필터, 통계.
 */
public class CorpusQueryService {

    public List<SearchHit> select(Map<String, List<Article>> corpus, String categoryFilter) {
        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<String, List<Article>> entry : corpus.entrySet()) {
            if (categoryFilter != null && !categoryFilter.equals(entry.getKey())) {
                continue;
            }
            for (Article article : entry.getValue()) {
                hits.add(new SearchHit(entry.getKey(), article));
            }
        }
        return hits;
    }

    /**
     * 제목 또는 본문에 검색어가 포함된(대소문자 무시) 기사를 찾습니다.
     */
    public List<SearchHit> search(Map<String, List<Article>> corpus, String query, String categoryFilter) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<SearchHit> hits = new ArrayList<>();
        for (SearchHit hit : select(corpus, categoryFilter)) {
            Article article = hit.getArticle();
            if (article.getTitle().toLowerCase(Locale.ROOT).contains(needle)
                    || article.getText().toLowerCase(Locale.ROOT).contains(needle)) {
                hits.add(hit);
            }
        }
        return hits;
    }

    // 경계는 포함이며, 수집 시각이 없는 기사는 제외합니다.
    public List<SearchHit> harvestedBetween(List<SearchHit> hits, Instant from, Instant to) {
        List<SearchHit> filtered = new ArrayList<>();
        for (SearchHit hit : hits) {
            Instant harvestedAt = hit.getArticle().getHarvestedAt();
            if (harvestedAt == null) {
                continue;
            }
            if (from != null && harvestedAt.isBefore(from)) {
                continue;
            }
            if (to != null && harvestedAt.isAfter(to)) {
                continue;
            }
            filtered.add(hit);
        }
        return filtered;
    }

    public CorpusStatistics statistics(Map<String, List<Article>> corpus) {
        int total = 0;
        Map<String, Integer> counts = new LinkedHashMap<>();
        Instant earliest = null;
        Instant latest = null;
        for (Map.Entry<String, List<Article>> entry : corpus.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().size());
            total += entry.getValue().size();
            for (Article article : entry.getValue()) {
                Instant harvestedAt = article.getHarvestedAt();
                if (harvestedAt == null) {
                    continue;
                }
                if (earliest == null || harvestedAt.isBefore(earliest)) {
                    earliest = harvestedAt;
                }
                if (latest == null || harvestedAt.isAfter(latest)) {
                    latest = harvestedAt;
                }
            }
        }
        return new CorpusStatistics(total, counts, earliest, latest);
    }
}
