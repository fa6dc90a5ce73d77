package fun.fengwk.lss.core.service.search.runtime;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.lss.core.service.browser.runtime.BrowserSession;
import fun.fengwk.lss.core.service.browser.runtime.NavigationException;
import fun.fengwk.lss.core.service.search.FetchProperties;
import fun.fengwk.lss.core.service.search.parser.AvailabilityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Loads a catalog search page in a worker's session and returns its rendered text.
 *
 * <p>Libby renders results client side, so after navigation the page is polled until its text
 * stops changing. Once an availability marker is present fewer unchanged checks are required.
 * A page that does not settle before the ready timeout fails with {@link NavigationException}.
 * A positive settle delay replaces the poll with a fixed wait.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogPageFetcher {

    private final FetchProperties fetchProperties;
    private final AvailabilityClassifier availabilityClassifier;

    public String fetch(BrowserSession session, String url) {
        Page page = session.page();
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) fetchProperties.getNavigateTimeoutMs())
            );
            if (fetchProperties.getSettleDelayMs() > 0) {
                page.waitForTimeout(fetchProperties.getSettleDelayMs());
                return extractText(page.content());
            }
            return awaitReady(page, url);
        } catch (PlaywrightException ex) {
            throw new NavigationException("failed to load " + url + ": " + ex.getMessage(), ex);
        }
    }

    private String awaitReady(Page page, String url) {
        int checkIntervalMs = Math.max(50, fetchProperties.getStabilityCheckIntervalMs());
        int stableThreshold = Math.max(1, fetchProperties.getStabilityThreshold());
        int markedStableThreshold = Math.max(1, Math.min(stableThreshold, fetchProperties.getMarkedStabilityThreshold()));
        long deadlineAt = System.currentTimeMillis() + Math.max(checkIntervalMs, fetchProperties.getReadyTimeoutMs());

        String lastText = null;
        int stableRounds = 0;
        while (true) {
            String text = extractText(page.content());
            if (!text.isEmpty() && text.equals(lastText)) {
                stableRounds++;
                // A marker only shortens the wait, result cards keep rendering after the first one.
                boolean marked = availabilityClassifier.hasAvailabilityMarker(text);
                if (stableRounds >= (marked ? markedStableThreshold : stableThreshold)) {
                    log.debug("page settled, url={}, marked={}, stableRounds={}", url, marked, stableRounds);
                    return text;
                }
            } else {
                stableRounds = 0;
            }
            lastText = text;

            if (System.currentTimeMillis() >= deadlineAt) {
                break;
            }
            page.waitForTimeout(checkIntervalMs);
        }

        log.warn("page not ready, url={}, readyTimeoutMs={}, stableThreshold={}",
            url, fetchProperties.getReadyTimeoutMs(), stableThreshold);
        throw new NavigationException(
            "page not ready within " + fetchProperties.getReadyTimeoutMs() + "ms: " + url);
    }

    static String extractText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }

}
