package fun.fengwk.lss.core.service.search.runtime;

import fun.fengwk.lss.core.service.browser.runtime.BrowserSession;
import fun.fengwk.lss.core.service.browser.runtime.BrowserSessionTask;
import fun.fengwk.lss.core.service.browser.runtime.NavigationException;
import fun.fengwk.lss.core.service.browser.runtime.SessionCreationException;
import fun.fengwk.lss.core.service.browser.runtime.TaskFallback;
import fun.fengwk.lss.core.service.search.model.PageClassification;
import fun.fengwk.lss.core.service.search.model.SearchResult;
import fun.fengwk.lss.core.service.search.model.SearchTask;
import fun.fengwk.lss.core.service.search.parser.AvailabilityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetch then classify one catalog search page.
 *
 * <p>Also serves as the fallback that downgrades a failed lookup to an
 * {@link fun.fengwk.lss.core.service.search.model.AvailabilityState#UNKNOWN} result.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogSearchTask implements BrowserSessionTask<SearchTask, SearchResult>,
    TaskFallback<SearchTask, SearchResult> {

    private final CatalogPageFetcher catalogPageFetcher;
    private final AvailabilityClassifier availabilityClassifier;

    @Override
    public SearchResult execute(SearchTask task, BrowserSession session) {
        String pageText = catalogPageFetcher.fetch(session, task.getSearchUrl());
        PageClassification classification = availabilityClassifier.classify(pageText);
        return SearchResult.of(task, classification);
    }

    @Override
    public SearchResult onFailure(SearchTask task, Exception cause) {
        if (cause instanceof SessionCreationException) {
            log.warn("session unavailable, catalog={}, title={}, error={}",
                task.getCatalogName(), task.getTitle(), cause.getMessage());
        } else if (cause instanceof NavigationException) {
            log.warn("navigation failed, catalog={}, title={}, url={}, error={}",
                task.getCatalogName(), task.getTitle(), task.getSearchUrl(), cause.getMessage());
        } else {
            log.warn("search task failed, catalog={}, title={}, url={}, error={}",
                task.getCatalogName(), task.getTitle(), task.getSearchUrl(), cause.getMessage(), cause);
        }
        return SearchResult.failed(task, cause.getMessage());
    }

}
