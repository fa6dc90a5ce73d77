package fun.fengwk.lss.core.service.search.progress;

/**
 * Receives run progress. Purely informational.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = (completed, total) -> {
    };

    /**
     * Called once per completed task, with strictly increasing {@code completed} values.
     */
    void onProgress(int completed, int total);

}
