package fun.fengwk.lss.core.service.browser.runtime;

/**
 * Creates the rendering session for a worker.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    /**
     * Create a new session for the given worker.
     *
     * @param workerId id of the worker that will own the session
     * @return a fresh session, never {@code null}
     * @throws SessionCreationException if the browser cannot be launched
     */
    BrowserSession create(int workerId);

}
