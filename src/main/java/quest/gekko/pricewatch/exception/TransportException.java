package quest.gekko.pricewatch.exception;

import quest.gekko.pricewatch.domain.FetchErrorType;

public class TransportException extends FetchException {
    public TransportException(String productId, String detail, Throwable cause) {
        super(FetchErrorType.TRANSPORT_ERROR, productId,
              "Transport error fetching product '" + productId + "': " + detail, cause);
    }
}
