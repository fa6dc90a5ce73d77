package fun.fengwk.lss.core.service.search.model;

import fun.fengwk.lss.core.service.readinglist.ReadingListEntry;
import fun.fengwk.lss.core.service.search.progress.ProgressListener;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Input of one search run.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchRequest {

    /**
     * Already filtered reading list.
     */
    private List<ReadingListEntry> entries;

    /**
     * Catalog name to base url, iterated in map order.
     */
    private Map<String, String> catalogs;

    /**
     * Worker count, {@code null} uses the configured default.
     */
    private Integer workerCount;

    private ProgressListener progressListener;

}
