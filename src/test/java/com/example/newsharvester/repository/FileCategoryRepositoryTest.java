package com.example.newsharvester.repository;

import com.example.newsharvester.model.Article;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileCategoryRepository 테스트
 */
class FileCategoryRepositoryTest {

    @TempDir
    Path dataDir;

    private FileCategoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileCategoryRepository(dataDir, new ArticleJsonFile(), Logger.getLogger("test"));
    }

    private static Article article(String slug, Long sourceId) {
        return new Article("https://news.example/" + slug, "Наслов " + slug, "Текст " + slug,
                List.of("skopje"), sourceId, Instant.parse("2025-01-02T03:04:05Z"));
    }

    @Test
    @DisplayName("파일이 없으면 NOT_FOUND와 빈 목록")
    void missingFileIsNotFound() {
        StoreLoadResult result = repository.load("skopje");

        assertThat(result.getStatus()).isEqualTo(StoreLoadResult.Status.NOT_FOUND);
        assertThat(result.getArticles()).isEmpty();
    }

    @Test
    @DisplayName("깨진 JSON은 PARSE_ERROR와 빈 목록")
    void corruptFileIsParseError() throws Exception {
        Files.writeString(dataDir.resolve("skopje.json"), "[{\"url\": ", StandardCharsets.UTF_8);

        StoreLoadResult result = repository.load("skopje");

        assertThat(result.getStatus()).isEqualTo(StoreLoadResult.Status.PARSE_ERROR);
        assertThat(result.getArticles()).isEmpty();
        assertThat(result.getError()).isNotBlank();
    }

    @Test
    @DisplayName("배열이 아닌 JSON도 PARSE_ERROR")
    void nonArrayIsParseError() throws Exception {
        Files.writeString(dataDir.resolve("skopje.json"), "{\"url\": \"x\"}", StandardCharsets.UTF_8);

        assertThat(repository.load("skopje").getStatus()).isEqualTo(StoreLoadResult.Status.PARSE_ERROR);
    }

    @Test
    @DisplayName("저장 후 읽으면 순서와 필드가 유지")
    void saveThenLoadKeepsOrderAndFields() throws Exception {
        List<Article> articles = List.of(article("b", 2L), article("a", null), article("c", 3L));

        repository.save("skopje", articles);
        StoreLoadResult result = repository.load("skopje");

        assertThat(result.getStatus()).isEqualTo(StoreLoadResult.Status.LOADED);
        assertThat(result.getArticles()).extracting(Article::getUrl)
                .containsExactly("https://news.example/b", "https://news.example/a", "https://news.example/c");
        Article loaded = result.getArticles().get(1);
        assertThat(loaded.getTitle()).isEqualTo("Наслов a");
        assertThat(loaded.getText()).isEqualTo("Текст a");
        assertThat(loaded.getCategories()).containsExactly("skopje");
        assertThat(loaded.getSourceId()).isNull();
        assertThat(loaded.getHarvestedAt()).isEqualTo(Instant.parse("2025-01-02T03:04:05Z"));
    }

    @Test
    @DisplayName("파일 형식은 url, title, text, categories, page_id, scraped_at 필드의 배열")
    void persistedShapeIsCompatible() throws Exception {
        repository.save("skopje", List.of(article("a", 7L), article("b", null)));

        String raw = Files.readString(dataDir.resolve("skopje.json"), StandardCharsets.UTF_8);
        JSONArray array = new JSONArray(raw);

        assertThat(raw).contains("Наслов a");
        JSONObject first = array.getJSONObject(0);
        assertThat(first.keySet()).containsExactlyInAnyOrder("url", "title", "text", "categories", "page_id", "scraped_at");
        assertThat(first.getLong("page_id")).isEqualTo(7L);
        assertThat(first.getJSONArray("categories").getString(0)).isEqualTo("skopje");
        assertThat(first.getString("scraped_at")).isEqualTo("2025-01-02T03:04:05Z");
        assertThat(array.getJSONObject(1).isNull("page_id")).isTrue();
    }

    @Test
    @DisplayName("쓰기 실패 시 StorageWriteException, 기존 파일은 그대로")
    void failedSaveKeepsPreviousContent() throws Exception {
        repository.save("skopje", List.of(article("a", 1L)));
        Path file = dataDir.resolve("skopje.json");
        String before = Files.readString(file, StandardCharsets.UTF_8);

        // 임시 파일 자리에 비어 있지 않은 디렉터리를 두어 쓰기를 실패시킵니다.
        Path blocker = dataDir.resolve("skopje.json" + ArticleJsonFile.TEMP_SUFFIX);
        Files.createDirectory(blocker);
        Files.writeString(blocker.resolve("keep"), "x");

        assertThatThrownBy(() -> repository.save("skopje", List.of(article("a", 1L), article("b", 2L))))
                .isInstanceOf(StorageWriteException.class);

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(before);
        assertThat(repository.load("skopje").getArticles()).hasSize(1);
    }

    @Test
    @DisplayName("url이 없는 항목은 건너뛰고 개수를 보고")
    void skipsEntriesWithoutUrl() throws Exception {
        Files.writeString(dataDir.resolve("skopje.json"),
                "[{\"url\": \"https://news.example/a\", \"title\": \"A\"}, {\"title\": \"no url\"}, 42]",
                StandardCharsets.UTF_8);

        StoreLoadResult result = repository.load("skopje");

        assertThat(result.getStatus()).isEqualTo(StoreLoadResult.Status.LOADED);
        assertThat(result.getArticles()).hasSize(1);
        assertThat(result.getSkippedEntries()).isEqualTo(2);
    }

    @Test
    @DisplayName("카테고리 목록은 .json 파일만 사전순으로")
    void listsCategoriesSorted() throws Exception {
        Files.writeString(dataDir.resolve("zena.json"), "[]");
        Files.writeString(dataDir.resolve("ekonomija.json"), "[]");
        Files.writeString(dataDir.resolve("fudbal.json.tmp"), "[]");
        Files.writeString(dataDir.resolve("notes.txt"), "x");

        assertThat(repository.listCategories()).containsExactly("ekonomija", "zena");
    }

    @Test
    @DisplayName("loadAll은 읽을 수 있는 파일만 포함")
    void loadAllSkipsCorruptFiles() throws Exception {
        repository.save("zena", List.of(article("a", 1L)));
        Files.writeString(dataDir.resolve("broken.json"), "{{", StandardCharsets.UTF_8);

        Map<String, List<Article>> corpus = repository.loadAll();

        assertThat(corpus).containsOnlyKeys("zena");
    }

    @Test
    @DisplayName("저장된 URL 집합")
    void existingUrls() {
        assertThat(repository.existingUrls(List.of(article("a", 1L), article("b", 2L))))
                .containsExactly("https://news.example/a", "https://news.example/b");
    }

    @Test
    @DisplayName("경로 문자가 포함된 카테고리 이름은 거부")
    void rejectsPathLikeCategoryNames() {
        assertThatThrownBy(() -> repository.load("../etc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repository.fileFor("a/b")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("손상된 파일 백업")
    void backsUpCorruptFile() throws Exception {
        Files.writeString(dataDir.resolve("skopje.json"), "garbage", StandardCharsets.UTF_8);

        Path backup = repository.backupCorrupt("skopje");

        assertThat(backup.getFileName().toString()).startsWith("skopje.json.corrupt-");
        assertThat(Files.readString(backup, StandardCharsets.UTF_8)).isEqualTo("garbage");
        assertThat(dataDir.resolve("skopje.json")).exists();
    }
}
