package fun.fengwk.lss.core.service.readinglist;

/**
 * Thrown when the reading list cannot be read. Aborts the run before any lookup starts.
 *
 * @author fengwk
 */
public class ReadingListReadException extends RuntimeException {

    public ReadingListReadException(String message) {
        super(message);
    }

    public ReadingListReadException(String message, Throwable cause) {
        super(message, cause);
    }

}
