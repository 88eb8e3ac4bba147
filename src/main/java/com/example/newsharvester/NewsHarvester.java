/**
 * NewsHarvester는 뉴스 수집기 애플리케이션의 진입점입니다.
 * - harvest [카테고리...]: 카탈로그의 모든(또는 지정한) 카테고리를 수집하여 카테고리별 JSON 파일에 저장합니다.
 * - consolidate [--output 파일]: 모든 카테고리 파일을 URL 기준으로 중복 제거하여 하나의 파일로 합칩니다.
 * - query [--stats] [--search 키워드] [--category 이름] [--since 날짜] [--until 날짜] [--export 파일] [--limit N]
 * - count: 카테고리 파일별 기사 수와 합계를 출력합니다.
 * 설정은 HarvesterConfig(harvester.properties + HARVESTER_* 환경 변수)에서 읽고,
 * 각 구현체를 생성자 주입으로 조립합니다. 카테고리별 오류는 종료 코드에 영향을 주지 않으며,
 * 데이터 디렉터리나 설정을 준비하지 못한 경우에만 0이 아닌 값으로 종료합니다.
 */

package com.example.newsharvester;

import com.example.newsharvester.config.CategoryCatalog;
import com.example.newsharvester.config.ConfigurationException;
import com.example.newsharvester.config.HarvesterConfig;
import com.example.newsharvester.model.Article;
import com.example.newsharvester.model.MergeResult;
import com.example.newsharvester.model.SearchHit;
import com.example.newsharvester.repository.ArticleJsonFile;
import com.example.newsharvester.repository.FileCategoryRepository;
import com.example.newsharvester.repository.StorageWriteException;
import com.example.newsharvester.service.ApiPageFetcher;
import com.example.newsharvester.service.ContentNormalizer;
import com.example.newsharvester.service.CorpusMerger;
import com.example.newsharvester.service.CorpusQueryService;
import com.example.newsharvester.service.HarvestRunner;
import com.example.newsharvester.service.HarvestService;
import com.example.newsharvester.service.PageFetcher;
import com.example.newsharvester.service.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class NewsHarvester {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String DEFAULT_CONSOLIDATED_FILE = "consolidated_data.json";
    private static final int DEFAULT_LIMIT = 10;

    private final HarvesterConfig config;
    private final Logger logger;
    private final ReportPrinter printer;
    private final ArticleJsonFile jsonFile = new ArticleJsonFile();

    NewsHarvester(HarvesterConfig config, Logger logger, PrintStream out) {
        this.config = config;
        this.logger = logger;
        this.printer = new ReportPrinter(out);
    }

    public static void main(String[] args) {
        configureLogging();
        Logger logger = Logger.getLogger(NewsHarvester.class.getName());

        HarvesterConfig config;
        try {
            config = HarvesterConfig.load();
        } catch (ConfigurationException e) {
            logger.severe("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_FAILURE);
            return;
        }
        System.exit(new NewsHarvester(config, logger, System.out).execute(args));
    }

    int execute(String[] args) {
        String command = args.length == 0 ? "harvest" : args[0];
        String[] rest = args.length == 0 ? new String[0] : Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (command) {
                case "harvest":
                    return harvest(rest);
                case "consolidate":
                    return consolidate(parseOptions(rest, Set.of("--output"), Set.of()));
                case "query":
                    return query(parseOptions(rest,
                            Set.of("--search", "--category", "--since", "--until", "--export", "--limit"),
                            Set.of("--stats")));
                case "count":
                    return count();
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }
        } catch (IllegalArgumentException e) {
            logger.severe(e.getMessage());
            logger.info("Usage: harvest [category...] | consolidate [--output file] | "
                    + "query [--stats] [--search kw] [--category name] [--since date] [--until date] "
                    + "[--export file] [--limit n] | count");
            return EXIT_USAGE;
        }
    }

    private int harvest(String[] categories) {
        Path dataDir = config.getDataDir();
        logger.info("Starting API harvest with category-based file storage in " + dataDir);
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            logger.severe("Cannot create data directory " + dataDir + ": " + e);
            return EXIT_FAILURE;
        }
        if (!Files.isWritable(dataDir)) {
            logger.severe("Data directory is not writable: " + dataDir);
            return EXIT_FAILURE;
        }

        CategoryCatalog catalog;
        try {
            catalog = CategoryCatalog.load(config.getCatalogLocation());
            if (categories.length > 0) {
                catalog = catalog.restrictTo(new LinkedHashSet<>(Arrays.asList(categories)));
            }
        } catch (ConfigurationException e) {
            logger.severe("Cannot load category catalog: " + e.getMessage());
            return EXIT_FAILURE;
        }

        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        PageFetcher fetcher = new ApiPageFetcher(client, config.getApiUrl(), config.getPageSize(),
                config.getUserAgent(), config.getRequestTimeout(), config.getDelay(), Sleeper.SYSTEM, logger);
        FileCategoryRepository repository = new FileCategoryRepository(dataDir, jsonFile, logger);
        ContentNormalizer normalizer = new ContentNormalizer(config.getBoilerplatePhrases());
        HarvestService harvestService = new HarvestService(fetcher, repository, normalizer,
                config.getCorruptStorePolicy(), config.getMaxPages(), Clock.systemUTC(), logger);

        new HarvestRunner(harvestService, repository, logger).run(catalog);
        return EXIT_OK;
    }

    private int consolidate(Map<String, String> options) {
        Map<String, List<Article>> corpus = loadCorpus();
        if (corpus == null) {
            return EXIT_FAILURE;
        }
        MergeResult result = new CorpusMerger().merge(corpus);
        if (result.getArticles().isEmpty()) {
            logger.severe("No articles found in " + config.getDataDir());
            return EXIT_FAILURE;
        }
        Path output = Path.of(options.getOrDefault("--output", DEFAULT_CONSOLIDATED_FILE));
        try {
            jsonFile.write(output, result.getArticles());
        } catch (StorageWriteException e) {
            logger.severe(e.getMessage());
            return EXIT_FAILURE;
        }
        logger.info("Saved " + result.getArticles().size() + " articles to " + output);
        printer.printMergeStats(result);
        return EXIT_OK;
    }

    private int query(Map<String, String> options) {
        String search = options.get("--search");
        String category = options.get("--category");
        Instant since = options.containsKey("--since") ? parseBound(options.get("--since"), false) : null;
        Instant until = options.containsKey("--until") ? parseBound(options.get("--until"), true) : null;
        int limit = parseLimit(options.get("--limit"));

        Map<String, List<Article>> corpus = loadCorpus();
        if (corpus == null) {
            return EXIT_FAILURE;
        }
        CorpusQueryService queries = new CorpusQueryService();
        if (options.containsKey("--stats") || (search == null && category == null && since == null && until == null)) {
            printer.printStatistics(queries.statistics(corpus));
            return EXIT_OK;
        }

        List<SearchHit> hits = search != null
                ? queries.search(corpus, search, category)
                : queries.select(corpus, category);
        if (since != null || until != null) {
            hits = queries.harvestedBetween(hits, since, until);
        }
        printer.printHits(hits, limit);

        if (options.containsKey("--export")) {
            List<Article> articles = new ArrayList<>();
            for (SearchHit hit : hits) {
                articles.add(hit.getArticle());
            }
            Path export = Path.of(options.get("--export"));
            try {
                jsonFile.write(export, articles);
            } catch (StorageWriteException e) {
                logger.severe(e.getMessage());
                return EXIT_FAILURE;
            }
            logger.info("Exported " + articles.size() + " articles to " + export);
        }
        return EXIT_OK;
    }

    private int count() {
        Map<String, List<Article>> corpus = loadCorpus();
        if (corpus == null) {
            return EXIT_FAILURE;
        }
        printer.printCounts(new CorpusQueryService().statistics(corpus));
        return EXIT_OK;
    }

    private Map<String, List<Article>> loadCorpus() {
        FileCategoryRepository repository = new FileCategoryRepository(config.getDataDir(), jsonFile, logger);
        try {
            Map<String, List<Article>> corpus = repository.loadAll();
            logger.info("Loaded " + corpus.size() + " category files from " + config.getDataDir());
            return corpus;
        } catch (IOException e) {
            logger.severe("Cannot read data directory: " + e.getMessage());
            return null;
        }
    }

    static Map<String, String> parseOptions(String[] args, Set<String> valueFlags, Set<String> booleanFlags) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (booleanFlags.contains(arg)) {
                options.put(arg, "true");
            } else if (valueFlags.contains(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                options.put(arg, args[++i]);
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return options;
    }

    // 날짜만 주어지면 --since는 그날 00:00, --until은 그날 마지막 순간(UTC)으로 해석합니다.
    static Instant parseBound(String raw, boolean endOfDay) {
        try {
            LocalDate date = LocalDate.parse(raw);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusNanos(1)
                    : date.atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException notADate) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid date: " + raw, e);
            }
        }
    }

    private static int parseLimit(String raw) {
        if (raw == null) {
            return DEFAULT_LIMIT;
        }
        try {
            int limit = Integer.parseInt(raw);
            if (limit < 0) {
                throw new IllegalArgumentException("--limit must not be negative: " + raw);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit is not a number: " + raw, e);
        }
    }

    private static void configureLogging() {
        try (InputStream in = NewsHarvester.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(NewsHarvester.class.getName()).warning("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
