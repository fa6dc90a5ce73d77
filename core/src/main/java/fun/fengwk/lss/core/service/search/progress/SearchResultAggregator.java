package fun.fengwk.lss.core.service.search.progress;

import fun.fengwk.lss.core.service.search.model.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects results in arrival order and counts completions.
 *
 * <p>Append, increment and notification happen under one lock, so listeners observe strictly
 * increasing counts and the collection size always equals the completed count.
 *
 * @author fengwk
 */
@Slf4j
public class SearchResultAggregator implements Consumer<SearchResult> {

    private final int total;
    private final ProgressListener progressListener;
    private final List<SearchResult> results;
    private int completed;

    public SearchResultAggregator(int total, ProgressListener progressListener) {
        this.total = total;
        this.progressListener = progressListener == null ? ProgressListener.NOOP : progressListener;
        this.results = new ArrayList<>(total);
    }

    @Override
    public synchronized void accept(SearchResult result) {
        results.add(result);
        completed++;
        log.info("{} @ {}: {}{}", result.getTitle(), result.getCatalogName(), result.getAvailability(),
            formatFlags(result));
        try {
            progressListener.onProgress(completed, total);
        } catch (RuntimeException ex) {
            log.warn("progress listener failed, completed={}, total={}, error={}", completed, total, ex.getMessage());
        }
    }

    public synchronized int getCompleted() {
        return completed;
    }

    public synchronized boolean isDrained() {
        return completed == total;
    }

    /**
     * Snapshot of the results collected so far, in arrival order.
     */
    public synchronized List<SearchResult> getResults() {
        return List.copyOf(results);
    }

    private String formatFlags(SearchResult result) {
        StringBuilder flags = new StringBuilder();
        if (result.isAudiobook()) {
            flags.append(" [audiobook]");
        }
        if (result.isEbook()) {
            flags.append(" [ebook]");
        }
        return flags.toString();
    }

}
