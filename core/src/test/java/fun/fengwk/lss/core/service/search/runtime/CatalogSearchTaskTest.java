package fun.fengwk.lss.core.service.search.runtime;

import fun.fengwk.lss.core.service.browser.runtime.BrowserSession;
import fun.fengwk.lss.core.service.browser.runtime.NavigationException;
import fun.fengwk.lss.core.service.browser.runtime.SessionCreationException;
import fun.fengwk.lss.core.service.search.model.AvailabilityState;
import fun.fengwk.lss.core.service.search.model.SearchResult;
import fun.fengwk.lss.core.service.search.model.SearchTask;
import fun.fengwk.lss.core.service.search.parser.AvailabilityClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class CatalogSearchTaskTest {

    @Mock
    private CatalogPageFetcher catalogPageFetcher;

    @Mock
    private BrowserSession session;

    private CatalogSearchTask catalogSearchTask;
    private SearchTask task;

    @BeforeEach
    void setUp() {
        catalogSearchTask = new CatalogSearchTask(catalogPageFetcher, new AvailabilityClassifier());
        task = SearchTask.builder()
            .catalogName("hawaii")
            .searchUrl("https://libbyapp.com/library/hawaii/search/query-Going%20Postal/page-1")
            .title("Going Postal")
            .author("Terry Pratchett")
            .build();
    }

    @Test
    public void shouldClassifyFetchedPage() {
        when(catalogPageFetcher.fetch(session, task.getSearchUrl()))
            .thenReturn("Going Postal Terry Pratchett Borrow this title Play Sample");

        SearchResult result = catalogSearchTask.execute(task, session);

        assertThat(result.getAvailability()).isEqualTo(AvailabilityState.AVAILABLE);
        assertThat(result.isAudiobook()).isTrue();
        assertThat(result.isEbook()).isFalse();
        assertThat(result.getTitle()).isEqualTo("Going Postal");
        assertThat(result.getAuthor()).isEqualTo("Terry Pratchett");
        assertThat(result.getCatalogName()).isEqualTo("hawaii");
        assertThat(result.getSearchUrl()).isEqualTo(task.getSearchUrl());
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    public void shouldPropagateNavigationFailureToWorker() {
        when(catalogPageFetcher.fetch(session, task.getSearchUrl()))
            .thenThrow(new NavigationException("page not ready within 20000ms"));

        assertThatThrownBy(() -> catalogSearchTask.execute(task, session))
            .isInstanceOf(NavigationException.class);
    }

    @Test
    public void shouldDowngradeFailureToUnknown() {
        SearchResult navigationFailed = catalogSearchTask.onFailure(task, new NavigationException("page not ready"));
        SearchResult sessionFailed = catalogSearchTask.onFailure(task, new SessionCreationException("launch failed"));
        SearchResult otherFailed = catalogSearchTask.onFailure(task, new IllegalStateException());

        assertThat(navigationFailed.getAvailability()).isEqualTo(AvailabilityState.UNKNOWN);
        assertThat(navigationFailed.isAudiobook()).isFalse();
        assertThat(navigationFailed.isEbook()).isFalse();
        assertThat(navigationFailed.getError()).isEqualTo("page not ready");
        assertThat(navigationFailed.getSearchUrl()).isEqualTo(task.getSearchUrl());
        assertThat(sessionFailed.getError()).isEqualTo("launch failed");
        assertThat(otherFailed.isFailed()).isTrue();
        assertThat(otherFailed.getError()).isEqualTo("unknown error");
    }

}
