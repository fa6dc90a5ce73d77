package fun.fengwk.lss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import fun.fengwk.lss.core.service.browser.BrowserProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PlaywrightBrowserSessionFactoryTest {

    private BrowserProperties browserProperties;
    private PlaywrightBrowserSessionFactory sessionFactory;

    @BeforeEach
    void setUp() {
        browserProperties = new BrowserProperties();
        sessionFactory = new PlaywrightBrowserSessionFactory(browserProperties);
    }

    @Test
    public void shouldLaunchHeadlessWithoutAutomationFlagByDefault() {
        BrowserType.LaunchOptions options = sessionFactory.buildLaunchOptions();

        assertThat(options.headless).isTrue();
        assertThat(options.ignoreDefaultArgs).containsExactly("--enable-automation");
        assertThat(options.args).isNull();
        assertThat(options.proxy).isNull();
        assertThat(options.executablePath).isNull();
    }

    @Test
    public void shouldApplyLaunchOverrides() {
        browserProperties.setHeadless(false);
        browserProperties.setLaunchArgs(List.of("--disable-gpu"));
        browserProperties.setProxyServer("http://127.0.0.1:7890");
        browserProperties.setProxyUsername("reader");
        browserProperties.setExecutablePath("/opt/chromium/chrome");

        BrowserType.LaunchOptions options = sessionFactory.buildLaunchOptions();

        assertThat(options.headless).isFalse();
        assertThat(options.args).containsExactly("--disable-gpu");
        assertThat(options.proxy.server).isEqualTo("http://127.0.0.1:7890");
        assertThat(options.proxy.username).isEqualTo("reader");
        assertThat(options.proxy.password).isNull();
        assertThat(options.executablePath).hasToString("/opt/chromium/chrome");
    }

    @Test
    public void shouldPickUserAgentFromPool() {
        browserProperties.setUserAgents(List.of("agent-a", "agent-b"));

        Browser.NewContextOptions options = sessionFactory.buildContextOptions();

        assertThat(options.userAgent).isIn("agent-a", "agent-b");
        assertThat(options.extraHTTPHeaders).containsEntry("Accept-Language", "en-US,en;q=0.9");
    }

    @Test
    public void shouldPreferFixedUserAgentAndExplicitHeaders() {
        browserProperties.setUserAgent("fixed-agent");
        browserProperties.setLocale("en-US");
        browserProperties.setTimezoneId("Pacific/Honolulu");
        browserProperties.setExtraHeaders(Map.of("Accept-Language", "en-GB", "X-Empty", " "));

        Browser.NewContextOptions options = sessionFactory.buildContextOptions();

        assertThat(options.userAgent).isEqualTo("fixed-agent");
        assertThat(options.locale).isEqualTo("en-US");
        assertThat(options.timezoneId).isEqualTo("Pacific/Honolulu");
        assertThat(options.extraHTTPHeaders).containsExactly(Map.entry("Accept-Language", "en-GB"));
    }

    @Test
    public void shouldLeaveContextUntouchedWhenNothingConfigured() {
        browserProperties.setUserAgents(List.of());
        browserProperties.setAcceptLanguage("");

        Browser.NewContextOptions options = sessionFactory.buildContextOptions();

        assertThat(options.userAgent).isNull();
        assertThat(options.extraHTTPHeaders).isNull();
    }

}
