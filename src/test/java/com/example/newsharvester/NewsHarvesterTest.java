package com.example.newsharvester;

import com.example.newsharvester.config.HarvesterConfig;
import com.example.newsharvester.model.Article;
import com.example.newsharvester.repository.ArticleJsonFile;
import com.example.newsharvester.repository.StoreLoadResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * NewsHarvester 명령 테스트. 데이터 디렉터리는 임시 디렉터리, 원격 API는 로컬 HttpServer를 사용합니다.
 */
class NewsHarvesterTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final ArticleJsonFile jsonFile = new ArticleJsonFile();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private NewsHarvester harvester(Map<String, String> env) throws Exception {
        Map<String, String> merged = new HashMap<>(env);
        merged.putIfAbsent("HARVESTER_DATA_DIR", tempDir.resolve("data").toString());
        merged.putIfAbsent("HARVESTER_DELAY_MS", "0");
        return new NewsHarvester(HarvesterConfig.load(merged), Logger.getLogger("test"),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private void writeCategory(String category, Article... articles) throws Exception {
        jsonFile.write(tempDir.resolve("data").resolve(category + ".json"), List.of(articles));
    }

    private static Article article(String slug, String title, String category) {
        return new Article("https://news.example/" + slug, title, "Текст за " + title, List.of(category),
                null, Instant.parse("2025-02-0" + (slug.length() % 9 + 1) + "T10:00:00Z"));
    }

    // categories 파라미터별로 첫 페이지에 게시물 하나를 주고, 그다음 페이지는 400으로 끝냅니다.
    private void handle(HttpExchange exchange) throws IOException {
        String query = exchange.getRequestURI().getRawQuery();
        boolean firstPage = query.contains("&page=1&");
        String category = query.replaceAll(".*categories=(\\d+).*", "$1");
        String body = firstPage
                ? "[{\"id\": " + category + ", \"link\": \"https://news.example/post-" + category + "\", "
                + "\"title\": {\"rendered\": \"Post " + category + "\"}, \"content\": {\"rendered\": \"<p>Body</p>\"}}]"
                : "{\"code\": \"rest_post_invalid_page_number\"}";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(firstPage ? 200 : 400, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("harvest: 카탈로그의 각 카테고리를 수집하여 파일로 저장")
    void harvestWritesOneFilePerCategory() throws Exception {
        // given
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/posts", this::handle);
        server.start();
        Path catalog = tempDir.resolve("catalog.json");
        Files.writeString(catalog, "[{\"name\": \"sport\", \"id\": 7}, {\"name\": \"svet\", \"id\": 8}]");
        NewsHarvester harvester = harvester(Map.of(
                "HARVESTER_API_URL", "http://127.0.0.1:" + server.getAddress().getPort() + "/posts",
                "HARVESTER_CATALOG", catalog.toString()));

        // when
        int exitCode = harvester.execute(new String[]{"harvest"});
        int secondExitCode = harvester.execute(new String[]{});

        // then
        assertThat(exitCode).isEqualTo(NewsHarvester.EXIT_OK);
        assertThat(secondExitCode).isEqualTo(NewsHarvester.EXIT_OK);
        StoreLoadResult sport = jsonFile.read(tempDir.resolve("data").resolve("sport.json"));
        assertThat(sport.getArticles()).extracting(Article::getUrl).containsExactly("https://news.example/post-7");
        assertThat(jsonFile.read(tempDir.resolve("data").resolve("svet.json")).getArticles()).hasSize(1);
    }

    @Test
    @DisplayName("harvest: 원격 API에 연결할 수 없어도 종료 코드 0")
    void harvestSucceedsDespiteCategoryErrors() throws Exception {
        Path catalog = tempDir.resolve("catalog.json");
        Files.writeString(catalog, "[{\"name\": \"sport\", \"id\": 7}]");
        NewsHarvester harvester = harvester(Map.of(
                "HARVESTER_API_URL", "http://127.0.0.1:1/posts",
                "HARVESTER_CATALOG", catalog.toString()));

        assertThat(harvester.execute(new String[]{"harvest"})).isEqualTo(NewsHarvester.EXIT_OK);
        assertThat(jsonFile.read(tempDir.resolve("data").resolve("sport.json")).getStatus())
                .isEqualTo(StoreLoadResult.Status.LOADED);
    }

    @Test
    @DisplayName("harvest: 데이터 디렉터리를 만들 수 없으면 종료 코드 1")
    void harvestFailsWithoutWritableDataDir() throws Exception {
        Path notADirectory = tempDir.resolve("occupied");
        Files.writeString(notADirectory, "file");

        int exitCode = harvester(Map.of("HARVESTER_DATA_DIR", notADirectory.toString())).execute(new String[]{"harvest"});

        assertThat(exitCode).isEqualTo(NewsHarvester.EXIT_FAILURE);
    }

    @Test
    @DisplayName("harvest: 카탈로그에 없는 카테고리를 지정하면 종료 코드 1")
    void harvestRejectsUnknownCategory() throws Exception {
        assertThat(harvester(Map.of()).execute(new String[]{"harvest", "nope"})).isEqualTo(NewsHarvester.EXIT_FAILURE);
    }

    @Test
    @DisplayName("consolidate: 중복 URL을 제거한 하나의 파일 생성")
    void consolidateMergesCategoryFiles() throws Exception {
        // given
        writeCategory("hrana", article("a", "A", "hrana"), article("bb", "B", "hrana"));
        writeCategory("zdravje", article("a", "A", "zdravje"), article("ccc", "C", "zdravje"));
        Path out = tempDir.resolve("consolidated.json");

        // when
        int exitCode = harvester(Map.of()).execute(new String[]{"consolidate", "--output", out.toString()});

        // then
        assertThat(exitCode).isEqualTo(NewsHarvester.EXIT_OK);
        List<Article> merged = jsonFile.read(out).getArticles();
        assertThat(merged).extracting(Article::getUrl)
                .containsExactly("https://news.example/a", "https://news.example/bb", "https://news.example/ccc");
        assertThat(merged.get(0).getCategories()).containsExactly("hrana", "zdravje");
        assertThat(printed()).contains("Duplicates removed: 1");
    }

    @Test
    @DisplayName("consolidate: 데이터 디렉터리가 없으면 종료 코드 1")
    void consolidateFailsWithoutDataDir() throws Exception {
        assertThat(harvester(Map.of()).execute(new String[]{"consolidate"})).isEqualTo(NewsHarvester.EXIT_FAILURE);
    }

    @Test
    @DisplayName("query: 검색 결과 출력 및 내보내기")
    void querySearchesAndExports() throws Exception {
        writeCategory("hrana", article("a", "Ајвар", "hrana"), article("bb", "Пита", "hrana"));
        writeCategory("zdravje", article("ccc", "Ајвар и здравје", "zdravje"));
        Path export = tempDir.resolve("results.json");

        int exitCode = harvester(Map.of()).execute(
                new String[]{"query", "--search", "ајвар", "--export", export.toString(), "--limit", "1"});

        assertThat(exitCode).isEqualTo(NewsHarvester.EXIT_OK);
        assertThat(printed()).contains("Found 2 matching articles").contains("[hrana] Ајвар").contains("... and 1 more results");
        assertThat(jsonFile.read(export).getArticles()).hasSize(2);
    }

    @Test
    @DisplayName("query: 옵션이 없으면 통계 출력")
    void queryDefaultsToStatistics() throws Exception {
        writeCategory("hrana", article("a", "A", "hrana"), article("bb", "B", "hrana"));

        int exitCode = harvester(Map.of()).execute(new String[]{"query"});

        assertThat(exitCode).isEqualTo(NewsHarvester.EXIT_OK);
        assertThat(printed()).contains("Total articles: 2").contains("hrana");
    }

    @Test
    @DisplayName("count: 파일별 기사 수와 합계")
    void countPrintsTotals() throws Exception {
        writeCategory("hrana", article("a", "A", "hrana"));
        writeCategory("zena", article("bb", "B", "zena"), article("ccc", "C", "zena"));

        assertThat(harvester(Map.of()).execute(new String[]{"count"})).isEqualTo(NewsHarvester.EXIT_OK);
        assertThat(printed()).contains("zena.json").contains("TOTAL ARTICLES: 3");
    }

    @Test
    @DisplayName("알 수 없는 명령이나 옵션은 사용법 오류")
    void rejectsUnknownCommandsAndOptions() throws Exception {
        assertThat(harvester(Map.of()).execute(new String[]{"split"})).isEqualTo(NewsHarvester.EXIT_USAGE);
        assertThat(harvester(Map.of()).execute(new String[]{"query", "--verbose"})).isEqualTo(NewsHarvester.EXIT_USAGE);
        assertThat(harvester(Map.of()).execute(new String[]{"query", "--since", "last week"})).isEqualTo(NewsHarvester.EXIT_USAGE);
    }

    @Test
    @DisplayName("날짜 경계 해석")
    void parsesDateBounds() {
        assertThat(NewsHarvester.parseBound("2025-02-01", false)).isEqualTo(Instant.parse("2025-02-01T00:00:00Z"));
        assertThat(NewsHarvester.parseBound("2025-02-01", true)).isEqualTo(Instant.parse("2025-02-01T23:59:59.999999999Z"));
        assertThat(NewsHarvester.parseBound("2025-02-01T10:00:00+01:00", false)).isEqualTo(Instant.parse("2025-02-01T09:00:00Z"));
    }
}
