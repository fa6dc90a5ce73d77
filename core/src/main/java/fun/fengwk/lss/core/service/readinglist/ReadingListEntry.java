package fun.fengwk.lss.core.service.readinglist;

import lombok.Builder;
import lombok.Value;

/**
 * One book row of a reading list export.
 *
 * @author fengwk
 */
@Value
@Builder
public class ReadingListEntry {

    public static final String TO_READ_SHELF = "to-read";

    String title;
    String author;
    String exclusiveShelf;

    public boolean isToRead() {
        return TO_READ_SHELF.equals(exclusiveShelf);
    }

}
