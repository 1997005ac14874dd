package quest.gekko.pricewatch.exception;

import quest.gekko.pricewatch.domain.FetchErrorType;

public class FetchTimeoutException extends FetchException {
    public FetchTimeoutException(String productId, Throwable cause) {
        super(FetchErrorType.TIMEOUT, productId, "Timed out fetching product '" + productId + "'.", cause);
    }
}
