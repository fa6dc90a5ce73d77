package fun.fengwk.lss.core.service.search.parser;

import fun.fengwk.lss.core.service.search.model.AvailabilityState;
import fun.fengwk.lss.core.service.search.model.PageClassification;
import org.springframework.stereotype.Component;

/**
 * Classifies rendered Libby search page text by literal markers.
 *
 * <p>Availability markers are checked in fixed priority order and the first hit wins:
 * {@value #MARKER_NO_RESULTS}, then {@value #MARKER_BORROW}, then {@value #MARKER_PLACE_HOLD}.
 * Format flags are evaluated independently of the availability outcome.
 *
 * @author fengwk
 */
@Component
public class AvailabilityClassifier {

    public static final String MARKER_NO_RESULTS = "No results.";
    public static final String MARKER_BORROW = "Borrow";
    public static final String MARKER_PLACE_HOLD = "Place Hold";
    public static final String MARKER_AUDIOBOOK = "Play Sample";
    public static final String MARKER_EBOOK = "Read Sample";

    public PageClassification classify(String pageText) {
        if (pageText == null) {
            return PageClassification.unknown();
        }
        return new PageClassification(
            resolveAvailability(pageText),
            pageText.contains(MARKER_AUDIOBOOK),
            pageText.contains(MARKER_EBOOK)
        );
    }

    /**
     * Whether the text carries any availability marker, i.e. the result list has rendered.
     */
    public boolean hasAvailabilityMarker(String pageText) {
        return pageText != null && resolveAvailability(pageText) != AvailabilityState.UNKNOWN;
    }

    private AvailabilityState resolveAvailability(String pageText) {
        if (pageText.contains(MARKER_NO_RESULTS)) {
            return AvailabilityState.NOT_FOUND;
        }
        if (pageText.contains(MARKER_BORROW)) {
            return AvailabilityState.AVAILABLE;
        }
        if (pageText.contains(MARKER_PLACE_HOLD)) {
            return AvailabilityState.OWNED;
        }
        return AvailabilityState.UNKNOWN;
    }

}
