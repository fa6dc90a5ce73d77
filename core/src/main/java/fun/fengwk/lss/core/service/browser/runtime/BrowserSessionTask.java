package fun.fengwk.lss.core.service.browser.runtime;

/**
 * Unit of work executed by a worker with its own session.
 *
 * @param <T> task type
 * @param <R> result type
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionTask<T, R> {

    R execute(T task, BrowserSession session) throws Exception;

}
