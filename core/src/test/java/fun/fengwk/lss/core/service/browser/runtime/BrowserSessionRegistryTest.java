package fun.fengwk.lss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * @author fengwk
 */
public class BrowserSessionRegistryTest {

    private final List<Playwright> drivers = new ArrayList<>();

    @Test
    public void shouldCreateSessionLazilyAndReuseIt() {
        AtomicInteger created = new AtomicInteger();
        BrowserSessionRegistry registry = new BrowserSessionRegistry(workerId -> {
            created.incrementAndGet();
            return newSession(workerId);
        }, 2);

        assertThat(registry.activeSessionCount()).isZero();

        BrowserSession first = registry.acquireSession(0);
        BrowserSession second = registry.acquireSession(0);
        BrowserSession other = registry.acquireSession(1);

        assertThat(first).isSameAs(second);
        assertThat(other).isNotSameAs(first);
        assertThat(other.getWorkerId()).isEqualTo(1);
        assertThat(created.get()).isEqualTo(2);
        assertThat(registry.activeSessionCount()).isEqualTo(2);
    }

    @Test
    public void shouldWrapCreationFailureAndRetryOnNextAcquire() {
        AtomicInteger attempts = new AtomicInteger();
        BrowserSessionRegistry registry = new BrowserSessionRegistry(workerId -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("chromium not installed");
            }
            return newSession(workerId);
        }, 1);

        assertThatThrownBy(() -> registry.acquireSession(0))
            .isInstanceOf(SessionCreationException.class)
            .hasMessageContaining("chromium not installed");
        assertThat(registry.activeSessionCount()).isZero();

        assertThat(registry.acquireSession(0)).isNotNull();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    public void shouldRejectNullSession() {
        BrowserSessionRegistry registry = new BrowserSessionRegistry(workerId -> null, 1);

        assertThatThrownBy(() -> registry.acquireSession(0))
            .isInstanceOf(SessionCreationException.class);
    }

    @Test
    public void shouldReleaseEverySessionExactlyOnce() {
        BrowserSessionRegistry registry = new BrowserSessionRegistry(this::newSession, 3);
        BrowserSession first = registry.acquireSession(0);
        BrowserSession third = registry.acquireSession(2);

        registry.releaseSession(0);
        registry.releaseAll();
        registry.releaseAll();

        assertThat(first.isClosed()).isTrue();
        assertThat(third.isClosed()).isTrue();
        assertThat(registry.activeSessionCount()).isZero();
        for (Playwright driver : drivers) {
            verify(driver, times(1)).close();
        }
        assertThatThrownBy(() -> registry.acquireSession(1))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldRejectUnknownWorkerId() {
        BrowserSessionRegistry registry = new BrowserSessionRegistry(this::newSession, 2);

        assertThatThrownBy(() -> registry.acquireSession(2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.acquireSession(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BrowserSessionRegistry(this::newSession, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private BrowserSession newSession(int workerId) {
        Playwright playwright = mock(Playwright.class);
        drivers.add(playwright);
        return new BrowserSession(workerId, playwright, mock(Browser.class), mock(BrowserContext.class), mock(Page.class));
    }

}
