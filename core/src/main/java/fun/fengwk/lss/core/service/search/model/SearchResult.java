package fun.fengwk.lss.core.service.search.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one {@link SearchTask}.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchResult {

    String title;
    String author;
    String catalogName;
    AvailabilityState availability;
    boolean audiobook;
    boolean ebook;
    String searchUrl;

    /**
     * Set only when the lookup failed and the result was downgraded to {@link AvailabilityState#UNKNOWN}.
     */
    String error;

    public static SearchResult of(SearchTask task, PageClassification classification) {
        return SearchResult.builder()
            .title(task.getTitle())
            .author(task.getAuthor())
            .catalogName(task.getCatalogName())
            .availability(classification.availability())
            .audiobook(classification.audiobook())
            .ebook(classification.ebook())
            .searchUrl(task.getSearchUrl())
            .build();
    }

    public static SearchResult failed(SearchTask task, String error) {
        return SearchResult.builder()
            .title(task.getTitle())
            .author(task.getAuthor())
            .catalogName(task.getCatalogName())
            .availability(AvailabilityState.UNKNOWN)
            .searchUrl(task.getSearchUrl())
            .error(error == null ? "unknown error" : error)
            .build();
    }

    public boolean isFailed() {
        return error != null;
    }

}
