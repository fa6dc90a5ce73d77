package fun.fengwk.lss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * @author fengwk
 */
public class BrowserSessionTest {

    @Test
    public void shouldCloseResourcesOnceInOrder() {
        Playwright playwright = mock(Playwright.class);
        Browser browser = mock(Browser.class);
        BrowserContext browserContext = mock(BrowserContext.class);
        Page page = mock(Page.class);
        BrowserSession session = new BrowserSession(3, playwright, browser, browserContext, page);

        session.close();
        session.close();

        assertThat(session.isClosed()).isTrue();
        InOrder inOrder = inOrder(page, browserContext, browser, playwright);
        inOrder.verify(page, times(1)).close();
        inOrder.verify(browserContext, times(1)).close();
        inOrder.verify(browser, times(1)).close();
        inOrder.verify(playwright, times(1)).close();
    }

    @Test
    public void shouldStillCloseDriverWhenBrowserCloseFails() {
        Playwright playwright = mock(Playwright.class);
        Browser browser = mock(Browser.class);
        doThrow(new PlaywrightException("Target page, context or browser has been closed")).when(browser).close();
        BrowserSession session = new BrowserSession(0, playwright, browser, mock(BrowserContext.class), mock(Page.class));

        session.close();

        verify(playwright, times(1)).close();
    }

    @Test
    public void shouldRejectPageAccessAfterClose() {
        Page page = mock(Page.class);
        BrowserSession session = new BrowserSession(1, mock(Playwright.class), mock(Browser.class),
            mock(BrowserContext.class), page);

        assertThat(session.page()).isSameAs(page);
        session.close();

        assertThatThrownBy(session::page)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("workerId=1");
    }

}
