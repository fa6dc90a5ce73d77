package fun.fengwk.lss.core.service.search.impl;

import fun.fengwk.lss.core.service.browser.runtime.BrowserSessionFactory;
import fun.fengwk.lss.core.service.browser.runtime.BrowserWorkerPool;
import fun.fengwk.lss.core.service.browser.runtime.WorkerPoolConfig;
import fun.fengwk.lss.core.service.readinglist.ReadingListEntry;
import fun.fengwk.lss.core.service.search.LibrarySearchService;
import fun.fengwk.lss.core.service.search.SearchProperties;
import fun.fengwk.lss.core.service.search.model.AvailabilityState;
import fun.fengwk.lss.core.service.search.model.SearchRequest;
import fun.fengwk.lss.core.service.search.model.SearchResult;
import fun.fengwk.lss.core.service.search.model.SearchTask;
import fun.fengwk.lss.core.service.search.parser.AvailabilityClassifier;
import fun.fengwk.lss.core.service.search.progress.SearchResultAggregator;
import fun.fengwk.lss.core.service.search.runtime.CatalogPageFetcher;
import fun.fengwk.lss.core.service.search.runtime.CatalogSearchTask;
import fun.fengwk.lss.core.service.search.support.SearchTaskGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Search service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LibrarySearchServiceImpl implements LibrarySearchService {

    private final SearchTaskGenerator searchTaskGenerator;
    private final CatalogPageFetcher catalogPageFetcher;
    private final AvailabilityClassifier availabilityClassifier;
    private final BrowserSessionFactory browserSessionFactory;
    private final SearchProperties searchProperties;

    @Override
    public List<SearchResult> search(SearchRequest request) {
        validateRequest(request);
        int workerCount = request.getWorkerCount() == null ? searchProperties.getWorkerCount() : request.getWorkerCount();
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }

        List<SearchTask> tasks = searchTaskGenerator.generate(request.getEntries(), request.getCatalogs());
        log.info("searching {} catalogs for {} titles, tasks={}, workers={}",
            request.getCatalogs().size(), request.getEntries().size(), tasks.size(), workerCount);
        if (tasks.isEmpty()) {
            return List.of();
        }

        long startAt = System.currentTimeMillis();
        SearchResultAggregator aggregator = new SearchResultAggregator(tasks.size(), request.getProgressListener());
        CatalogSearchTask catalogSearchTask = new CatalogSearchTask(catalogPageFetcher, availabilityClassifier);
        WorkerPoolConfig config = WorkerPoolConfig.builder()
            .workerCount(workerCount)
            .build();
        try (BrowserWorkerPool workerPool = new BrowserWorkerPool(config, browserSessionFactory)) {
            workerPool.execute(tasks, catalogSearchTask, catalogSearchTask, aggregator);
        }

        List<SearchResult> results = aggregator.getResults();
        logSummary(results, System.currentTimeMillis() - startAt);
        return results;
    }

    private void validateRequest(SearchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (request.getEntries() == null) {
            throw new IllegalArgumentException("entries is null");
        }
        if (request.getCatalogs() == null || request.getCatalogs().isEmpty()) {
            throw new IllegalArgumentException("catalogs is empty");
        }
        for (Map.Entry<String, String> catalog : request.getCatalogs().entrySet()) {
            String baseUrl = catalog.getValue() == null ? "" : catalog.getValue().trim().toLowerCase();
            if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
                throw new IllegalArgumentException("unsupported catalog url for " + catalog.getKey() + ": " + catalog.getValue());
            }
        }
        for (ReadingListEntry entry : request.getEntries()) {
            if (entry == null) {
                throw new IllegalArgumentException("entries must not contain null");
            }
        }
    }

    private void logSummary(List<SearchResult> results, long elapsedMs) {
        Map<AvailabilityState, Integer> counts = new EnumMap<>(AvailabilityState.class);
        int failed = 0;
        for (SearchResult result : results) {
            counts.merge(result.getAvailability(), 1, Integer::sum);
            if (result.isFailed()) {
                failed++;
            }
        }
        log.info("search completed, results={}, availability={}, failed={}, elapsedMs={}",
            results.size(), counts, failed, elapsedMs);
    }

}
