package fun.fengwk.lss.core.service.search.model;

/**
 * Availability state and format flags read from one rendered search page.
 *
 * @author fengwk
 */
public record PageClassification(AvailabilityState availability, boolean audiobook, boolean ebook) {

    public static PageClassification unknown() {
        return new PageClassification(AvailabilityState.UNKNOWN, false, false);
    }

}
