package fun.fengwk.lss.core.service.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import fun.fengwk.lss.core.service.search.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes search results as a CSV table, one row per result, in the given order.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SearchResultCsvWriter {

    private final ObjectWriter rowWriter;

    public SearchResultCsvWriter() {
        CsvMapper csvMapper = new CsvMapper();
        CsvSchema schema = csvMapper.schemaFor(ResultRow.class).withHeader();
        this.rowWriter = csvMapper.writer(schema);
    }

    public void write(Path outputFile, List<SearchResult> results) {
        List<ResultRow> rows = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            rows.add(ResultRow.of(result));
        }

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8);
                 SequenceWriter sequenceWriter = rowWriter.writeValues(writer)) {
                sequenceWriter.writeAll(rows);
            }
        } catch (IOException ex) {
            log.error("failed to write results, file={}, error={}", outputFile, ex.getMessage(), ex);
            throw new UncheckedIOException("failed to write results to " + outputFile, ex);
        }
        log.info("wrote {} results to {}", rows.size(), outputFile.toAbsolutePath());
    }

    @JsonPropertyOrder({"Title", "Author", "Library Name", "Availability", "Audiobook", "Ebook", "Search URL"})
    record ResultRow(
        @JsonProperty("Title") String title,
        @JsonProperty("Author") String author,
        @JsonProperty("Library Name") String libraryName,
        @JsonProperty("Availability") String availability,
        @JsonProperty("Audiobook") boolean audiobook,
        @JsonProperty("Ebook") boolean ebook,
        @JsonProperty("Search URL") String searchUrl
    ) {

        static ResultRow of(SearchResult result) {
            return new ResultRow(
                result.getTitle(),
                result.getAuthor() == null ? "" : result.getAuthor(),
                result.getCatalogName(),
                result.getAvailability().getValue(),
                result.isAudiobook(),
                result.isEbook(),
                result.getSearchUrl()
            );
        }

    }

}
