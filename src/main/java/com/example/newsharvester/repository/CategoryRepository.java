/**
 * CategoryRepository 인터페이스는 카테고리별 기사 컬렉션의 저장소 추상화 계층을 제공합니다.
 * - load(category): 카테고리 컬렉션을 읽습니다. 파일 없음/손상 여부는 StoreLoadResult로 구분됩니다.
 * - save(category, articles): 컬렉션 전체를 덮어씁니다. 실패 시 이전 내용이 그대로 남아야 합니다.
 * - backupCorrupt(category): 손상된 파일을 백업 사본으로 복사합니다.
 * - listCategories(): 저장된 카테고리 이름을 사전순으로 반환합니다.
 * - loadAll(): 읽을 수 있는 모든 카테고리 컬렉션을 이름순으로 반환합니다. 읽지 못한 파일은 제외됩니다.
 */

package com.example.newsharvester.repository;

import com.example.newsharvester.model.Article;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public interface CategoryRepository {
    StoreLoadResult load(String category);
    void save(String category, List<Article> articles) throws StorageWriteException;
    Path backupCorrupt(String category) throws IOException;
    List<String> listCategories() throws IOException;

    default Set<String> existingUrls(Collection<Article> articles) {
        Set<String> urls = new LinkedHashSet<>();
        for (Article article : articles) {
            urls.add(article.getUrl());
        }
        return urls;
    }

    default Map<String, List<Article>> loadAll() throws IOException {
        Map<String, List<Article>> corpus = new TreeMap<>();
        for (String category : listCategories()) {
            StoreLoadResult result = load(category);
            if (result.getStatus() == StoreLoadResult.Status.LOADED) {
                corpus.put(category, result.getArticles());
            }
        }
        return corpus;
    }
}
