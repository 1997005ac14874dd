package quest.gekko.pricewatch.domain;

/**
 * Why a fetch failed. Transient kinds are retried by the fetch client, permanent ones are not.
 */
public enum FetchErrorType {
    NOT_FOUND(false),
    TIMEOUT(true),
    RATE_LIMITED_BY_REMOTE(true),
    PARSE_FAILURE(false),
    TRANSPORT_ERROR(true);

    private final boolean transientFailure;

    FetchErrorType(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
