package fun.fengwk.lss.core.service.readinglist;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a Goodreads library export and keeps the books on the "to-read" shelf.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class GoodreadsExportReader {

    static final String COLUMN_TITLE = "Title";
    static final String COLUMN_AUTHOR = "Author";
    static final String COLUMN_EXCLUSIVE_SHELF = "Exclusive Shelf";

    private final ObjectReader rowReader;

    public GoodreadsExportReader() {
        CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();
        this.rowReader = csvMapper.readerFor(Map.class).with(CsvSchema.emptySchema().withHeader());
    }

    /**
     * Read every book on the "to-read" shelf, in file order.
     *
     * @throws ReadingListReadException if the file is missing, unreadable or lacks a required column
     */
    public List<ReadingListEntry> readToRead(Path exportFile) {
        List<ReadingListEntry> toRead = new ArrayList<>();
        List<ReadingListEntry> all = readAll(exportFile);
        for (ReadingListEntry entry : all) {
            if (entry.isToRead()) {
                toRead.add(entry);
            }
        }
        log.info("read reading list, file={}, rows={}, toRead={}", exportFile, all.size(), toRead.size());
        return toRead;
    }

    /**
     * Read every book row regardless of shelf.
     */
    public List<ReadingListEntry> readAll(Path exportFile) {
        if (exportFile == null || !Files.isRegularFile(exportFile)) {
            throw new ReadingListReadException("reading list file not found: " + exportFile);
        }

        List<ReadingListEntry> entries = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = rowReader.readValues(exportFile.toFile())) {
            // Reading ahead consumes the header line, so the schema is known even without data rows.
            boolean hasRows = rows.hasNext();
            checkRequiredColumns(exportFile, (CsvSchema) rows.getParserSchema());
            if (!hasRows) {
                return entries;
            }
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                entries.add(ReadingListEntry.builder()
                    .title(valueOf(row, COLUMN_TITLE))
                    .author(valueOf(row, COLUMN_AUTHOR))
                    .exclusiveShelf(valueOf(row, COLUMN_EXCLUSIVE_SHELF))
                    .build());
            }
            return entries;
        } catch (ReadingListReadException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            log.error("failed to read reading list, file={}, error={}", exportFile, ex.getMessage(), ex);
            throw new ReadingListReadException("failed to read reading list " + exportFile + ": " + ex.getMessage(), ex);
        }
    }

    private void checkRequiredColumns(Path exportFile, CsvSchema schema) {
        for (String column : List.of(COLUMN_TITLE, COLUMN_AUTHOR, COLUMN_EXCLUSIVE_SHELF)) {
            if (schema == null || schema.column(column) == null) {
                throw new ReadingListReadException(
                    "reading list " + exportFile + " is missing required column '" + column + "'");
            }
        }
    }

    private String valueOf(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }

}
