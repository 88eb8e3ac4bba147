/**
 * ApiPageFetcher 클래스는 PageFetcher 인터페이스의 HTTP 구현체입니다.
 * - WordPress REST API(wp/v2/posts)에 categories, page, per_page 파라미터로 GET 요청을 보냅니다.
 * - HTTP 400(마지막 페이지 이후) 또는 빈 배열은 END_OF_PAGINATION으로 처리합니다.
 * - 그 밖의 HTTP 오류, 네트워크 오류, JSON 파싱 오류는 TRANSIENT_ERROR로 처리합니다.
 * - 게시물을 받은 뒤에는 요청 간 지연 시간만큼 대기하여 요청 속도를 제한합니다.
 */

package com.example.newsharvester.service;

import com.example.newsharvester.model.PageResult;
import com.example.newsharvester.model.RawPost;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class ApiPageFetcher implements PageFetcher {
    private final HttpClient client;
    private final URI apiUrl;
    private final int pageSize;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Duration delay;
    private final Sleeper sleeper;
    private final Logger logger;

    public ApiPageFetcher(HttpClient client, URI apiUrl, int pageSize, String userAgent,
                          Duration requestTimeout, Duration delay, Sleeper sleeper, Logger logger) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.pageSize = pageSize;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.delay = delay;
        this.sleeper = sleeper;
        this.logger = logger;
    }

    @Override
    public PageResult fetchPage(long categoryId, int page) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(pageUri(categoryId, page))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            return PageResult.transientError("Request failed: " + e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PageResult.transientError("Interrupted while fetching page " + page);
        }

        int status = response.statusCode();
        logger.fine("API response code " + status + " for category " + categoryId + ", page " + page);
        if (status == 400) {
            return PageResult.endOfPagination();
        }
        if (status < 200 || status >= 300) {
            return PageResult.transientError("API call failed with HTTP " + status);
        }

        JSONArray items;
        try {
            items = new JSONArray(response.body());
        } catch (JSONException e) {
            return PageResult.transientError("Invalid JSON in response: " + e.getMessage());
        }
        if (items.isEmpty()) {
            return PageResult.endOfPagination();
        }

        List<RawPost> posts = new ArrayList<>();
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            RawPost post = item == null ? null : toRawPost(item);
            if (post == null) {
                logger.warning("Skipping post without link at index " + i + " of page " + page);
                continue;
            }
            posts.add(post);
        }

        pause();
        return PageResult.posts(posts);
    }

    URI pageUri(long categoryId, int page) {
        String base = apiUrl.toString();
        String separator = base.contains("?") ? "&" : "?";
        return URI.create("%s%scategories=%d&page=%d&per_page=%d".formatted(base, separator, categoryId, page, pageSize));
    }

    private RawPost toRawPost(JSONObject item) {
        String link = item.optString("link", "").trim();
        if (link.isEmpty()) {
            return null;
        }
        Object id = item.opt("id");
        return new RawPost(
                id instanceof Number ? ((Number) id).longValue() : null,
                link,
                rendered(item, "title"),
                rendered(item, "content"));
    }

    // WordPress는 title/content를 {"rendered": "..."} 형태로 내려줍니다.
    private static String rendered(JSONObject item, String field) {
        JSONObject nested = item.optJSONObject(field);
        if (nested != null) {
            return nested.optString("rendered", "");
        }
        return item.optString(field, "");
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted during request delay");
        }
    }
}
