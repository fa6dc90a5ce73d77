package fun.fengwk.lss.core.service.search.model;

/**
 * Availability of a title at one catalog.
 *
 * @author fengwk
 */
public enum AvailabilityState {

    /**
     * Can be borrowed now.
     */
    AVAILABLE("Available"),

    /**
     * Catalog owns copies but all are checked out, a hold is required.
     */
    OWNED("Owned"),

    /**
     * Catalog has no matching title.
     */
    NOT_FOUND("NotFound"),

    /**
     * Page matched none of the recognized markers, or the lookup failed.
     */
    UNKNOWN("Unknown");

    private final String value;

    AvailabilityState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

}
