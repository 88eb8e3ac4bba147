/**
 * HarvesterConfig는 수집기 실행 설정을 보관합니다.
 * - classpath의 harvester.properties에서 기본값을 읽고, HARVESTER_* 환경 변수가 있으면 그 값을 우선합니다.
 * - 숫자 설정이 잘못되었거나 필수 값이 비어 있으면 ConfigurationException을 던집니다.
 */

package com.example.newsharvester.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

public class HarvesterConfig {
    static final String RESOURCE = "harvester.properties";

    private final Path dataDir;
    private final URI apiUrl;
    private final int pageSize;
    private final Duration delay;
    private final int maxPages;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final String userAgent;
    private final String catalogLocation;
    private final CorruptStorePolicy corruptStorePolicy;
    private final List<String> boilerplatePhrases;

    HarvesterConfig(Properties props, Map<String, String> env) throws ConfigurationException {
        this.dataDir = Path.of(value(props, env, "dataDir"));
        this.apiUrl = toUri(value(props, env, "apiUrl"));
        this.pageSize = positiveInt(props, env, "pageSize");
        this.delay = Duration.ofMillis(nonNegativeLong(props, env, "delayMs"));
        this.maxPages = positiveInt(props, env, "maxPages");
        this.connectTimeout = Duration.ofSeconds(positiveInt(props, env, "connectTimeoutSeconds"));
        this.requestTimeout = Duration.ofSeconds(positiveInt(props, env, "requestTimeoutSeconds"));
        this.userAgent = value(props, env, "userAgent");
        this.catalogLocation = value(props, env, "catalog");
        this.corruptStorePolicy = policy(value(props, env, "onCorrupt"));
        this.boilerplatePhrases = phrases(value(props, env, "boilerplatePhrases"));
    }

    public static HarvesterConfig load() throws ConfigurationException {
        return load(System.getenv());
    }

    public static HarvesterConfig load(Map<String, String> env) throws ConfigurationException {
        Properties props = new Properties();
        InputStream in = HarvesterConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            throw new ConfigurationException("Missing configuration resource: " + RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + RESOURCE, e);
        }
        return new HarvesterConfig(props, env);
    }

    // harvester.dataDir -> HARVESTER_DATA_DIR
    static String envName(String key) {
        return "HARVESTER_" + key.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static String value(Properties props, Map<String, String> env, String key) throws ConfigurationException {
        String fromEnv = env.get(envName(key));
        String value = fromEnv != null && !fromEnv.isBlank() ? fromEnv : props.getProperty("harvester." + key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing configuration value: harvester." + key);
        }
        return value.trim();
    }

    private static int positiveInt(Properties props, Map<String, String> env, String key) throws ConfigurationException {
        long parsed = nonNegativeLong(props, env, key);
        if (parsed == 0 || parsed > Integer.MAX_VALUE) {
            throw new ConfigurationException("harvester." + key + " must be a positive int: " + parsed);
        }
        return (int) parsed;
    }

    private static long nonNegativeLong(Properties props, Map<String, String> env, String key) throws ConfigurationException {
        String raw = value(props, env, key);
        try {
            long parsed = Long.parseLong(raw);
            if (parsed < 0) {
                throw new ConfigurationException("harvester." + key + " must not be negative: " + raw);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("harvester." + key + " is not a number: " + raw, e);
        }
    }

    private static URI toUri(String raw) throws ConfigurationException {
        try {
            URI uri = URI.create(raw);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("harvester.apiUrl must be an absolute URL: " + raw);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("harvester.apiUrl is not a valid URL: " + raw, e);
        }
    }

    private static CorruptStorePolicy policy(String raw) throws ConfigurationException {
        try {
            return CorruptStorePolicy.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("harvester.onCorrupt must be SKIP or RESET: " + raw, e);
        }
    }

    private static List<String> phrases(String raw) {
        List<String> phrases = new ArrayList<>();
        for (String phrase : raw.split("\\|")) {
            if (!phrase.isBlank()) {
                phrases.add(phrase.trim());
            }
        }
        return List.copyOf(phrases);
    }

    public Path getDataDir() {
        return dataDir;
    }
    public URI getApiUrl() {
        return apiUrl;
    }
    public int getPageSize() {
        return pageSize;
    }
    public Duration getDelay() {
        return delay;
    }
    public int getMaxPages() {
        return maxPages;
    }
    public Duration getConnectTimeout() {
        return connectTimeout;
    }
    public Duration getRequestTimeout() {
        return requestTimeout;
    }
    public String getUserAgent() {
        return userAgent;
    }
    public String getCatalogLocation() {
        return catalogLocation;
    }
    public CorruptStorePolicy getCorruptStorePolicy() {
        return corruptStorePolicy;
    }
    public List<String> getBoilerplatePhrases() {
        return boilerplatePhrases;
    }
}
