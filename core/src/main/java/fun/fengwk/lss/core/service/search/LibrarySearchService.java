package fun.fengwk.lss.core.service.search;

import fun.fengwk.lss.core.service.search.model.SearchRequest;
import fun.fengwk.lss.core.service.search.model.SearchResult;

import java.util.List;

/**
 * Search entry: checks every reading list title against every catalog.
 *
 * @author fengwk
 */
public interface LibrarySearchService {

    /**
     * Run one search and block until every lookup has finished.
     *
     * @return one result per (title, catalog) pair, in completion order
     */
    List<SearchResult> search(SearchRequest request);

}
