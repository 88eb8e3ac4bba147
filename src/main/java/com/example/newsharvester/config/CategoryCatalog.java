/**
 * CategoryCatalog 클래스는 카테고리 이름과 원격 API 카테고리 ID의 고정 매핑입니다.
 * - 실행 시작 시 한 번 구성되며 실행 중에는 변경되지 않습니다.
 * - 등록 순서를 유지하므로 수집 순서가 설정 파일의 순서와 같습니다.
 * - JSON 배열([{"name": "...", "id": 123}, ...]) 형식의 설정을 classpath 또는 파일 경로에서 읽습니다.
 */

package com.example.newsharvester.config;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

public class CategoryCatalog {
    static final String CLASSPATH_PREFIX = "classpath:";

    private final Map<String, Long> categories;

    public CategoryCatalog(Map<String, Long> categories) {
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public static CategoryCatalog load(String location) throws ConfigurationException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = CategoryCatalog.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new ConfigurationException("Category catalog resource not found: " + resource);
            }
            try (in) {
                return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read category catalog: " + resource, e);
            }
        }
        try {
            return parse(Files.readString(Path.of(location), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read category catalog: " + location, e);
        }
    }

    public static CategoryCatalog parse(String json) throws ConfigurationException {
        Map<String, Long> categories = new LinkedHashMap<>();
        try {
            JSONArray entries = new JSONArray(json);
            for (int i = 0; i < entries.length(); i++) {
                JSONObject entry = entries.getJSONObject(i);
                String name = entry.getString("name").trim();
                if (name.isEmpty()) {
                    throw new ConfigurationException("Empty category name at index " + i);
                }
                if (categories.put(name, entry.getLong("id")) != null) {
                    throw new ConfigurationException("Duplicate category name: " + name);
                }
            }
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid category catalog: " + e.getMessage(), e);
        }
        if (categories.isEmpty()) {
            throw new ConfigurationException("Category catalog is empty");
        }
        return new CategoryCatalog(categories);
    }

    public Map<String, Long> asMap() {
        return categories;
    }

    public Set<String> names() {
        return categories.keySet();
    }

    public OptionalLong idOf(String name) {
        Long id = categories.get(name);
        return id == null ? OptionalLong.empty() : OptionalLong.of(id);
    }

    public int size() {
        return categories.size();
    }

    /**
     * 주어진 이름들만 남긴 카탈로그를 반환합니다. 카탈로그의 원래 순서를 따릅니다.
     */
    public CategoryCatalog restrictTo(Set<String> names) throws ConfigurationException {
        Map<String, Long> subset = new LinkedHashMap<>();
        for (String name : names) {
            if (!categories.containsKey(name)) {
                throw new ConfigurationException("Unknown category: " + name);
            }
        }
        categories.forEach((name, id) -> {
            if (names.contains(name)) {
                subset.put(name, id);
            }
        });
        return new CategoryCatalog(subset);
    }
}
