package fun.fengwk.lss.core.service.search.model;

import lombok.Builder;
import lombok.Value;

/**
 * One (title, catalog) lookup.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchTask {

    String catalogName;
    String searchUrl;
    String title;
    String author;

}
