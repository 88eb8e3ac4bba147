package com.example.newsharvester.service;

import com.example.newsharvester.config.CorruptStorePolicy;
import com.example.newsharvester.model.Article;
import com.example.newsharvester.model.HarvestResult;
import com.example.newsharvester.model.PageResult;
import com.example.newsharvester.model.RawPost;
import com.example.newsharvester.model.StopReason;
import com.example.newsharvester.repository.CategoryRepository;
import com.example.newsharvester.repository.CorruptStoreFileException;
import com.example.newsharvester.repository.StoreLoadResult;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class HarvestService {
    private final PageFetcher fetcher;
    private final CategoryRepository repository;
    private final ContentNormalizer normalizer;
    private final CorruptStorePolicy corruptStorePolicy;
    private final int maxPages;
    private final Clock clock;
    private final Logger logger;

    public HarvestService(PageFetcher fetcher, CategoryRepository repository, ContentNormalizer normalizer,
                          CorruptStorePolicy corruptStorePolicy, int maxPages, Clock clock, Logger logger) {
        this.fetcher = fetcher;
        this.repository = repository;
        this.normalizer = normalizer;
        this.corruptStorePolicy = corruptStorePolicy;
        this.maxPages = maxPages;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * harvest 메서드는 카테고리의 기존 컬렉션을 읽은 뒤 1페이지부터 차례로 요청하여
     * 아직 저장되지 않은 URL의 기사만 새로 만들어 기존 목록 뒤에 붙입니다.
     * 마지막 페이지 도달, 일시적 오류, 안전 상한 도달 또는 인터럽트 시 중단하며,
     * 중단 전에 만든 기사는 모두 결과에 포함됩니다. 저장은 호출자가 수행합니다.
     *
     * @param category   카테고리 이름(저장 파일 이름)
     * @param categoryId 원격 API의 카테고리 ID
     * @return 전체 컬렉션과 새로 추가된 기사 수
     * @throws CorruptStoreFileException 기존 파일을 읽을 수 없고 정책이 SKIP인 경우
     * @throws IOException               정책이 RESET이고 손상된 파일 백업에 실패한 경우
     */
    public HarvestResult harvest(String category, long categoryId) throws CorruptStoreFileException, IOException {
        logger.info("--- Harvesting category: " + category + " (ID: " + categoryId + ") ---");

        List<Article> existing = dropDuplicateUrls(category, loadExisting(category));
        Set<String> knownUrls = repository.existingUrls(existing);
        logger.info("Loaded " + existing.size() + " existing articles for " + category);

        List<Article> fresh = new ArrayList<>();
        StopReason stopReason = null;
        int lastPage = 0;

        for (int page = 1; page <= maxPages; page++) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warning("[" + category + "] Interrupted before page " + page + ".");
                stopReason = StopReason.INTERRUPTED;
                break;
            }

            PageResult result = fetcher.fetchPage(categoryId, page);
            lastPage = page;

            if (result.getKind() == PageResult.Kind.END_OF_PAGINATION) {
                logger.info("[" + category + "] Reached end of pagination at page " + page + ".");
                stopReason = StopReason.END_OF_PAGINATION;
                break;
            }
            if (result.getKind() == PageResult.Kind.TRANSIENT_ERROR) {
                logger.warning("[" + category + "] Error on page " + page + ": " + result.getReason());
                stopReason = StopReason.TRANSIENT_ERROR;
                break;
            }

            int added = collectNew(category, result.getPosts(), knownUrls, fresh);
            logger.info("[" + category + "] Page " + page + " finished. +" + added + " articles.");
        }

        if (stopReason == null) {
            logger.warning("[" + category + "] Stopped at the safety limit of " + maxPages + " pages.");
            stopReason = StopReason.PAGE_LIMIT;
        }

        List<Article> all = new ArrayList<>(existing.size() + fresh.size());
        all.addAll(existing);
        all.addAll(fresh);
        return new HarvestResult(category, all, fresh.size(), stopReason, lastPage);
    }

    private List<Article> loadExisting(String category) throws CorruptStoreFileException, IOException {
        StoreLoadResult loaded = repository.load(category);
        if (loaded.getStatus() != StoreLoadResult.Status.PARSE_ERROR) {
            return loaded.getArticles();
        }
        if (corruptStorePolicy == CorruptStorePolicy.SKIP) {
            throw new CorruptStoreFileException(category,
                    "Existing data for " + category + " is unreadable, category skipped: " + loaded.getError());
        }
        repository.backupCorrupt(category);
        logger.warning("[" + category + "] Unreadable data replaced by an empty collection.");
        return loaded.getArticles();
    }

    // 파일에 이미 중복 저장된 URL은 처음 나온 항목만 남깁니다.
    private List<Article> dropDuplicateUrls(String category, List<Article> loaded) {
        Set<String> seen = new HashSet<>();
        List<Article> unique = new ArrayList<>(loaded.size());
        for (Article article : loaded) {
            if (seen.add(article.getUrl())) {
                unique.add(article);
            }
        }
        int dropped = loaded.size() - unique.size();
        if (dropped > 0) {
            logger.warning("[" + category + "] Dropped " + dropped + " duplicate stored entries.");
        }
        return unique;
    }

    private int collectNew(String category, List<RawPost> posts, Set<String> knownUrls, List<Article> fresh) {
        int added = 0;
        for (RawPost post : posts) {
            // add()가 false면 이미 저장되었거나 이번 실행에서 이미 만든 기사입니다.
            if (!knownUrls.add(post.getLink())) {
                continue;
            }
            Article article = new Article(
                    post.getLink(),
                    normalizer.normalizeTitle(post.getRenderedTitle()),
                    normalizer.normalize(post.getRenderedContent()),
                    List.of(category),
                    post.getId(),
                    clock.instant());
            fresh.add(article);
            added++;
            logger.fine("[" + category + "] Harvested: " + abbreviate(article.getTitle()));
        }
        return added;
    }

    private static String abbreviate(String title) {
        return title.length() <= 50 ? title : title.substring(0, 50) + "...";
    }
}
