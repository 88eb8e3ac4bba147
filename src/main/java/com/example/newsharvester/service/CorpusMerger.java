/**
 * CorpusMerger는 여러 카테고리 컬렉션을 URL 기준으로 중복 없는 하나의 컬렉션으로 합칩니다.
 * - 원본은 이름의 사전순으로 순회하므로 결과 순서가 항상 같습니다.
 * - 같은 URL은 처음 본 기사만 남기고, 이후 중복의 카테고리는 남긴 기사의 카테고리 목록에 합칩니다.
 * - 입력 컬렉션은 변경하지 않습니다.
 */

package com.example.newsharvester.service;

import com.example.newsharvester.model.Article;
import com.example.newsharvester.model.MergeResult;
import com.example.newsharvester.model.SourceStats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class CorpusMerger {

    public MergeResult merge(Map<String, List<Article>> sources) {
        Map<String, Article> byUrl = new LinkedHashMap<>();
        List<SourceStats> stats = new ArrayList<>();
        int duplicates = 0;

        for (Map.Entry<String, List<Article>> source : new TreeMap<>(sources).entrySet()) {
            int unique = 0;
            for (Article article : source.getValue()) {
                Article kept = byUrl.get(article.getUrl());
                if (kept == null) {
                    byUrl.put(article.getUrl(), article);
                    unique++;
                } else {
                    byUrl.put(article.getUrl(), kept.withCategories(article.getCategories()));
                    duplicates++;
                }
            }
            stats.add(new SourceStats(source.getKey(), source.getValue().size(), unique));
        }
        return new MergeResult(new ArrayList<>(byUrl.values()), stats, duplicates);
    }
}
