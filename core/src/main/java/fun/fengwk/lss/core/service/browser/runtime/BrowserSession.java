package fun.fengwk.lss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rendering session owned by exactly one worker.
 *
 * <p>A session wraps one Playwright driver, one browser, one context and a single page that is
 * reused for every task routed to the owning worker. Playwright objects are bound to the thread
 * that created them, so a session must only be used and closed by its worker thread, except for
 * the forced release of a stuck worker during pool shutdown.
 * Close is idempotent and releases resources in strict order.
 *
 * @author fengwk
 */
public class BrowserSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);

    private final int workerId;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final Page page;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BrowserSession(
        int workerId,
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext,
        Page page
    ) {
        this.workerId = workerId;
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.page = page;
    }

    public int getWorkerId() {
        return workerId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Page page() {
        if (closed.get()) {
            throw new IllegalStateException("session is closed, workerId=" + workerId);
        }
        return page;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        closeStep("page", page);
        closeStep("browser context", browserContext);
        closeStep("browser", browser);
        // Closing the driver terminates the node process backing this session.
        closeStep("playwright", playwright);
        log.debug("browser session closed, workerId={}", workerId);
    }

    private void closeStep(String name, AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("{} already closed for worker {}, skip close", name, workerId);
            } else {
                log.warn("failed to close {} for worker {}", name, workerId, ex);
            }
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
