package fun.fengwk.lss.core.service.search.support;

import fun.fengwk.lss.core.service.readinglist.ReadingListEntry;
import fun.fengwk.lss.core.service.search.SearchProperties;
import fun.fengwk.lss.core.service.search.model.SearchTask;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one search task per (title, catalog) pair, titles first, then catalogs in map order.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SearchTaskGenerator {

    private final TitleNormalizer titleNormalizer;
    private final SearchProperties searchProperties;

    public List<SearchTask> generate(List<ReadingListEntry> entries, Map<String, String> catalogs) {
        List<SearchTask> tasks = new ArrayList<>(entries.size() * catalogs.size());
        for (ReadingListEntry entry : entries) {
            String title = titleNormalizer.normalize(entry.getTitle());
            String author = entry.getAuthor() == null ? "" : entry.getAuthor().trim();
            String encodedQuery = encodePathSegment(buildQuery(title, author));
            for (Map.Entry<String, String> catalog : catalogs.entrySet()) {
                tasks.add(SearchTask.builder()
                    .catalogName(catalog.getKey())
                    .searchUrl(buildSearchUrl(catalog.getValue(), encodedQuery))
                    .title(title)
                    .author(author)
                    .build());
            }
        }
        return tasks;
    }

    String buildQuery(String title, String author) {
        if (searchProperties.isIncludeAuthor() && StringUtils.hasText(author)) {
            return title + " " + author;
        }
        return title;
    }

    private String buildSearchUrl(String baseUrl, String encodedQuery) {
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/search/query-" + encodedQuery + "/page-1";
    }

    /**
     * Percent-encode a value as a single URL path segment per RFC 3986.
     *
     * <p>Only unreserved characters ({@code A-Z a-z 0-9 - . _ ~}) stay raw. A space becomes
     * {@code %20} and {@code /} becomes {@code %2F}, so a title containing a slash stays inside
     * the query segment.
     */
    static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }

}
