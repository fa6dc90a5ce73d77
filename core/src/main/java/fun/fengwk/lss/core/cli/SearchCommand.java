package fun.fengwk.lss.core.cli;

import fun.fengwk.lss.core.service.output.SearchResultCsvWriter;
import fun.fengwk.lss.core.service.readinglist.GoodreadsExportReader;
import fun.fengwk.lss.core.service.readinglist.ReadingListEntry;
import fun.fengwk.lss.core.service.search.LibrarySearchService;
import fun.fengwk.lss.core.service.search.SearchProperties;
import fun.fengwk.lss.core.service.search.model.SearchRequest;
import fun.fengwk.lss.core.service.search.model.SearchResult;
import fun.fengwk.lss.core.service.search.progress.LoggingProgressListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Command runner: reading list in, results table out.
 *
 * <p>Options override {@code lss.search.*} for a single run:
 * {@code --reading-list=<file>}, {@code --output=<file>}, {@code --workers=<n>}.
 * A reading list that cannot be read aborts the run before any browser starts.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lss.search", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SearchCommand implements ApplicationRunner {

    static final String OPTION_READING_LIST = "reading-list";
    static final String OPTION_OUTPUT = "output";
    static final String OPTION_WORKERS = "workers";

    private final GoodreadsExportReader goodreadsExportReader;
    private final LibrarySearchService librarySearchService;
    private final SearchResultCsvWriter searchResultCsvWriter;
    private final SearchProperties searchProperties;

    @Override
    public void run(ApplicationArguments args) {
        Path readingList = Paths.get(resolveOption(args, OPTION_READING_LIST, searchProperties.getReadingListPath()));
        Path output = Paths.get(resolveOption(args, OPTION_OUTPUT, searchProperties.getOutputPath()));
        int workerCount = resolveWorkerCount(args);

        List<ReadingListEntry> toRead = goodreadsExportReader.readToRead(readingList);
        log.info("to-read titles={}, libraries={}, workers={}",
            toRead.size(), searchProperties.getCatalogs().size(), workerCount);

        List<SearchResult> results = librarySearchService.search(SearchRequest.builder()
            .entries(toRead)
            .catalogs(new LinkedHashMap<>(searchProperties.getCatalogs()))
            .workerCount(workerCount)
            .progressListener(new LoggingProgressListener(
                "searching " + searchProperties.getCatalogs().size() + " libraries for " + toRead.size() + " books"))
            .build());

        searchResultCsvWriter.write(output, results);
    }

    private String resolveOption(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return defaultValue;
        }
        return values.get(values.size() - 1).trim();
    }

    private int resolveWorkerCount(ApplicationArguments args) {
        String raw = resolveOption(args, OPTION_WORKERS, String.valueOf(searchProperties.getWorkerCount()));
        try {
            int workerCount = Integer.parseInt(raw);
            if (workerCount < 1) {
                throw new IllegalArgumentException("--" + OPTION_WORKERS + " must be at least 1: " + raw);
            }
            return workerCount;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + OPTION_WORKERS + " is not a number: " + raw, ex);
        }
    }

}
