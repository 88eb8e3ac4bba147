package com.example.newsharvester;

import com.example.newsharvester.model.Article;
import com.example.newsharvester.model.CorpusStatistics;
import com.example.newsharvester.model.MergeResult;
import com.example.newsharvester.model.SearchHit;
import com.example.newsharvester.model.SourceStats;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 조회/병합 결과를 표준 출력에 사람이 읽을 수 있는 형태로 출력합니다.
 */
class ReportPrinter {
    private static final String RULE = "=".repeat(60);
    private static final int PREVIEW_LENGTH = 150;

    private final PrintStream out;

    ReportPrinter(PrintStream out) {
        this.out = out;
    }

    void printStatistics(CorpusStatistics stats) {
        out.println(RULE);
        out.println("DATA STATISTICS");
        out.println(RULE);
        out.printf("Total articles: %,d%n", stats.getTotalArticles());
        out.printf("Total categories: %d%n", stats.getTotalCategories());
        if (stats.getEarliest() != null) {
            out.println("Harvested between " + stats.getEarliest() + " and " + stats.getLatest());
        }
        out.println("Articles per category:");
        for (Map.Entry<String, Integer> entry : byCountDescending(stats.getCategoryCounts())) {
            double share = stats.getTotalArticles() == 0 ? 0 : 100.0 * entry.getValue() / stats.getTotalArticles();
            out.printf("  %-25s: %,6d (%5.1f%%)%n", entry.getKey(), entry.getValue(), share);
        }
        out.println(RULE);
    }

    void printCounts(CorpusStatistics stats) {
        for (Map.Entry<String, Integer> entry : new TreeMap<>(stats.getCategoryCounts()).entrySet()) {
            out.printf("  %-30s: %,d articles%n", entry.getKey() + ".json", entry.getValue());
        }
        out.println(RULE);
        out.printf("TOTAL ARTICLES: %,d%n", stats.getTotalArticles());
        out.println(RULE);
    }

    void printHits(List<SearchHit> hits, int limit) {
        out.printf("Found %d matching articles%n", hits.size());
        for (int i = 0; i < Math.min(limit, hits.size()); i++) {
            SearchHit hit = hits.get(i);
            Article article = hit.getArticle();
            out.printf("%d. [%s] %s%n", i + 1, hit.getCategory(), article.getTitle());
            out.println("   URL: " + article.getUrl());
            out.println("   Date: " + (article.getHarvestedAt() == null ? "Unknown" : article.getHarvestedAt()));
            String text = article.getText();
            out.println("   Preview: " + (text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text));
        }
        if (hits.size() > limit) {
            out.printf("... and %d more results%n", hits.size() - limit);
        }
    }

    void printMergeStats(MergeResult result) {
        int original = 0;
        for (SourceStats source : result.getSourceStats()) {
            original += source.getOriginalCount();
        }
        out.println(RULE);
        out.println("CONSOLIDATION STATISTICS");
        out.println(RULE);
        out.printf("Total articles across all categories: %,d%n", original);
        out.printf("Unique articles (after deduplication): %,d%n", result.getArticles().size());
        out.printf("Duplicates removed: %,d%n", result.getDuplicateCount());
        for (SourceStats source : result.getSourceStats()) {
            out.printf("  %-25s: %,6d total, %,6d unique, %,4d duplicates%n",
                    source.getSource(), source.getOriginalCount(), source.getUniqueCount(), source.getDuplicateCount());
        }
        out.println(RULE);
    }

    private static List<Map.Entry<String, Integer>> byCountDescending(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));
        return entries;
    }
}
