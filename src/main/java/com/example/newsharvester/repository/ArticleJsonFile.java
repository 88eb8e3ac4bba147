/**
 * ArticleJsonFile은 기사 목록을 JSON 배열 파일로 읽고 씁니다.
 * - 각 객체는 url, title, text, categories, page_id, scraped_at 필드를 가집니다.
 * - 쓰기는 같은 디렉터리의 임시 파일(.tmp)에 먼저 기록한 뒤 원자적으로 이동하므로,
 *   실패하더라도 기존 파일은 잘리거나 일부만 덮어쓰이지 않습니다.
 * - scraped_at은 UTC ISO-8601로 기록하며, 오프셋 없는 이전 형식 값은 UTC로 간주하여 읽습니다.
 */

package com.example.newsharvester.repository;

import com.example.newsharvester.model.Article;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public class ArticleJsonFile {
    static final String TEMP_SUFFIX = ".tmp";
    private static final int INDENT = 2;

    public StoreLoadResult read(Path file) {
        if (!Files.exists(file)) {
            return StoreLoadResult.notFound();
        }
        JSONArray entries;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            entries = new JSONArray(new JSONTokener(reader));
        } catch (IOException | JSONException e) {
            return StoreLoadResult.parseError(file + ": " + e.getMessage());
        }

        List<Article> articles = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < entries.length(); i++) {
            JSONObject entry = entries.optJSONObject(i);
            if (entry == null || entry.optString("url", "").isBlank()) {
                skipped++;
                continue;
            }
            articles.add(toArticle(entry));
        }
        return StoreLoadResult.loaded(articles, skipped);
    }

    public void write(Path file, List<Article> articles) throws StorageWriteException {
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(toJson(articles).toString(INDENT));
                writer.newLine();
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | JSONException e) {
            StorageWriteException failure = new StorageWriteException("Failed to write " + file + ": " + e.getMessage(), e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    JSONArray toJson(List<Article> articles) {
        JSONArray array = new JSONArray();
        for (Article article : articles) {
            JSONObject json = new JSONObject();
            json.put("url", article.getUrl());
            json.put("title", article.getTitle());
            json.put("text", article.getText());
            json.put("categories", new JSONArray(article.getCategories()));
            json.put("page_id", article.getSourceId() == null ? JSONObject.NULL : article.getSourceId());
            json.put("scraped_at", article.getHarvestedAt() == null ? JSONObject.NULL : article.getHarvestedAt().toString());
            array.put(json);
        }
        return array;
    }

    Article toArticle(JSONObject json) {
        List<String> categories = new ArrayList<>();
        JSONArray rawCategories = json.optJSONArray("categories");
        if (rawCategories != null) {
            for (int i = 0; i < rawCategories.length(); i++) {
                String category = rawCategories.optString(i, "");
                if (!category.isBlank()) {
                    categories.add(category);
                }
            }
        }
        Object pageId = json.opt("page_id");
        Long sourceId = pageId instanceof Number ? ((Number) pageId).longValue() : null;

        return new Article(
                json.optString("url", "").trim(),
                json.optString("title", ""),
                json.optString("text", ""),
                categories,
                sourceId,
                parseTimestamp(json.optString("scraped_at", "")));
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignored) {
            // 오프셋이 없는 값은 아래에서 UTC로 처리합니다.
        }
        try {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
