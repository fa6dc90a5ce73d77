package fun.fengwk.lss.core.service.browser.runtime;

/**
 * Thrown when a worker cannot obtain its rendering session.
 *
 * @author fengwk
 */
public class SessionCreationException extends RuntimeException {

    public SessionCreationException(String message) {
        super(message);
    }

    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }

}
