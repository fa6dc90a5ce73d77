package fun.fengwk.lss.core.service.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Search run configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lss.search")
public class SearchProperties {

    /**
     * Goodreads library export to read the "to-read" shelf from.
     */
    private String readingListPath = "goodreads_library_export.csv";

    /**
     * Where the results table is written.
     */
    private String outputPath = "results.csv";

    /**
     * Number of concurrent browser workers.
     */
    private int workerCount = 16;

    /**
     * Append the author to the title in the catalog query.
     */
    private boolean includeAuthor = true;

    /**
     * Catalog name to Libby library base url.
     *
     * <p>A library url can be found by picking the library in the Libby menu, which redirects to
     * a page like {@code https://libbyapp.com/library/beehive}. Bound maps merge into this one,
     * so the libraries searched by default are listed in {@code application.yml}.
     */
    private Map<String, String> catalogs = new LinkedHashMap<>();

}
