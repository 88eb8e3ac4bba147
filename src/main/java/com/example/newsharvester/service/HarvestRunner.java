/**
 * HarvestRunner는 카테고리 카탈로그 전체를 순서대로 수집하고 저장합니다.
 * - 카테고리는 한 번에 하나씩 처리하며, 한 카테고리의 실패(손상된 파일, 저장 실패, 예기치 않은 오류)는
 *   로그로 남기고 다음 카테고리로 넘어갑니다.
 * - 스레드가 인터럽트되면 진행 중이던 카테고리까지만 저장하고, 남은 카테고리는 수집하지 않은 것으로 보고합니다.
 * - 실행이 끝나면 새로 추가된 기사 수와 전체 기사 수를 요약합니다.
 */

package com.example.newsharvester.service;

import com.example.newsharvester.config.CategoryCatalog;
import com.example.newsharvester.model.HarvestResult;
import com.example.newsharvester.model.RunSummary;
import com.example.newsharvester.repository.CategoryRepository;
import com.example.newsharvester.repository.CorruptStoreFileException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HarvestRunner {
    private final HarvestService harvestService;
    private final CategoryRepository repository;
    private final Logger logger;

    public HarvestRunner(HarvestService harvestService, CategoryRepository repository, Logger logger) {
        this.harvestService = harvestService;
        this.repository = repository;
        this.logger = logger;
    }

    public RunSummary run(CategoryCatalog catalog) {
        int totalAdded = 0;
        int totalArticles = 0;
        List<String> harvested = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, Long> entry : catalog.asMap().entrySet()) {
            String category = entry.getKey();
            if (Thread.currentThread().isInterrupted()) {
                failed.add(category);
                continue;
            }
            try {
                HarvestResult result = harvestService.harvest(category, entry.getValue());
                save(category, result);
                totalAdded += result.getNewCount();
                totalArticles += result.getArticles().size();
                harvested.add(category);
            } catch (CorruptStoreFileException e) {
                logger.severe("[" + category + "] " + e.getMessage());
                failed.add(category);
            } catch (IOException e) {
                logger.severe("[" + category + "] Storage failure, previous data kept: " + e.getMessage());
                failed.add(category);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "[" + category + "] Unexpected error, category skipped", e);
                failed.add(category);
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            logger.warning("Harvest interrupted; remaining categories were not harvested.");
        }
        logger.info("Harvest finished. Added " + totalAdded + " new articles; "
                + totalArticles + " articles across " + harvested.size() + " categories.");
        if (!failed.isEmpty()) {
            logger.warning("Categories not harvested: " + failed);
        }
        return new RunSummary(totalAdded, totalArticles, harvested, failed);
    }

    // 인터럽트 상태에서는 파일 채널이 닫히므로 저장하는 동안만 플래그를 내려 둡니다.
    private void save(String category, HarvestResult result) throws IOException {
        boolean interrupted = Thread.interrupted();
        try {
            repository.save(category, result.getArticles());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
