package fun.fengwk.lss.core.service.browser.runtime;

/**
 * Thrown when a session cannot load a page or the page never becomes ready.
 *
 * @author fengwk
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }

}
