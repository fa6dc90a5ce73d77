package fun.fengwk.lss.core.service.browser.runtime;

/**
 * Maps a failed task to the result recorded in its place.
 *
 * @param <T> task type
 * @param <R> result type
 * @author fengwk
 */
@FunctionalInterface
public interface TaskFallback<T, R> {

    R onFailure(T task, Exception cause);

}
