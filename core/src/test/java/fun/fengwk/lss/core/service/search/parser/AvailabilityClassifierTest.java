package fun.fengwk.lss.core.service.search.parser;

import fun.fengwk.lss.core.service.search.model.AvailabilityState;
import fun.fengwk.lss.core.service.search.model.PageClassification;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class AvailabilityClassifierTest {

    private final AvailabilityClassifier classifier = new AvailabilityClassifier();

    @Test
    public void shouldClassifyBorrowableTitleAsAvailable() {
        PageClassification classification = classifier.classify("Going Postal Terry Pratchett Borrow this title Play Sample");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.AVAILABLE);
        assertThat(classification.audiobook()).isTrue();
        assertThat(classification.ebook()).isFalse();
    }

    @Test
    public void shouldClassifyHoldOnlyTitleAsOwned() {
        PageClassification classification = classifier.classify("Piranesi Place Hold Read Sample");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.OWNED);
        assertThat(classification.audiobook()).isFalse();
        assertThat(classification.ebook()).isTrue();
    }

    @Test
    public void shouldClassifyEmptyResultListAsNotFound() {
        PageClassification classification = classifier.classify("Search results No results. Try another search");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.NOT_FOUND);
    }

    @Test
    public void shouldPreferNotFoundOverBorrow() {
        PageClassification classification = classifier.classify("No results. Borrow Place Hold");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.NOT_FOUND);
    }

    @Test
    public void shouldPreferBorrowOverPlaceHold() {
        PageClassification classification = classifier.classify("Place Hold Borrow");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.AVAILABLE);
    }

    @Test
    public void shouldKeepFormatFlagsIndependentOfAvailability() {
        PageClassification classification = classifier.classify("No results. Play Sample");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.NOT_FOUND);
        assertThat(classification.audiobook()).isTrue();
        assertThat(classification.ebook()).isFalse();
    }

    @Test
    public void shouldClassifyUnrecognizedPageAsUnknown() {
        PageClassification classification = classifier.classify("Something went wrong. Read Sample");

        assertThat(classification.availability()).isEqualTo(AvailabilityState.UNKNOWN);
        assertThat(classification.ebook()).isTrue();
        assertThat(classifier.classify(null)).isEqualTo(PageClassification.unknown());
        assertThat(classifier.classify("")).isEqualTo(PageClassification.unknown());
    }

    @Test
    public void shouldMatchMarkersCaseSensitively() {
        assertThat(classifier.classify("borrow place hold no results.").availability())
            .isEqualTo(AvailabilityState.UNKNOWN);
    }

    @Test
    public void shouldDetectAvailabilityMarkers() {
        assertThat(classifier.hasAvailabilityMarker("Loading...")).isFalse();
        assertThat(classifier.hasAvailabilityMarker("Play Sample")).isFalse();
        assertThat(classifier.hasAvailabilityMarker("Place Hold")).isTrue();
        assertThat(classifier.hasAvailabilityMarker(null)).isFalse();
    }

}
