/**
 * FileCategoryRepository 클래스는 CategoryRepository 인터페이스의 파일 기반 구현체입니다.
 * - 카테고리마다 데이터 디렉터리 아래 "<카테고리>.json" 파일 하나를 사용합니다.
 * - 읽기에 실패한 파일은 PARSE_ERROR로 보고하며 Logger를 통해 경고를 남깁니다.
 * - 저장은 ArticleJsonFile을 통해 전체 파일을 원자적으로 교체합니다.
 */

package com.example.newsharvester.repository;

import com.example.newsharvester.model.Article;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileCategoryRepository implements CategoryRepository {
    static final String EXTENSION = ".json";

    private final Path dataDir;
    private final ArticleJsonFile jsonFile;
    private final Logger logger;

    public FileCategoryRepository(Path dataDir, ArticleJsonFile jsonFile, Logger logger) {
        this.dataDir = dataDir;
        this.jsonFile = jsonFile;
        this.logger = logger;
    }

    public Path fileFor(String category) {
        if (category == null || category.isBlank() || category.contains("/")
                || category.contains("\\") || category.startsWith(".")) {
            throw new IllegalArgumentException("Invalid category name: " + category);
        }
        return dataDir.resolve(category + EXTENSION);
    }

    @Override
    public StoreLoadResult load(String category) {
        Path file = fileFor(category);
        StoreLoadResult result = jsonFile.read(file);
        switch (result.getStatus()) {
            case PARSE_ERROR:
                logger.warning("Failed to read " + file + ": " + result.getError());
                break;
            case LOADED:
                if (result.getSkippedEntries() > 0) {
                    logger.warning("Skipped " + result.getSkippedEntries() + " entries without url in " + file);
                }
                break;
            default:
                break;
        }
        return result;
    }

    @Override
    public void save(String category, List<Article> articles) throws StorageWriteException {
        Path file = fileFor(category);
        jsonFile.write(file, articles);
        logger.info("[" + category + "] Saved " + articles.size() + " articles to " + file);
    }

    @Override
    public Path backupCorrupt(String category) throws IOException {
        Path file = fileFor(category);
        Path backup = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
        logger.warning("Backed up unreadable " + file + " to " + backup);
        return backup;
    }

    @Override
    public List<String> listCategories() throws IOException {
        if (!Files.isDirectory(dataDir)) {
            throw new IOException("Data directory not found: " + dataDir);
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION) && !name.startsWith("."))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public Path getDataDir() {
        return dataDir;
    }
}
