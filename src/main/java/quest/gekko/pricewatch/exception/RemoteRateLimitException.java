package quest.gekko.pricewatch.exception;

import quest.gekko.pricewatch.domain.FetchErrorType;

public class RemoteRateLimitException extends FetchException {
    public RemoteRateLimitException(String productId, int status) {
        super(FetchErrorType.RATE_LIMITED_BY_REMOTE, productId,
              "Source refused product '" + productId + "' with HTTP " + status + ".", null);
    }
}
