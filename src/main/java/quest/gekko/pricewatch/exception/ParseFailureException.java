package quest.gekko.pricewatch.exception;

import quest.gekko.pricewatch.domain.FetchErrorType;

public class ParseFailureException extends FetchException {
    public ParseFailureException(String productId, String detail) {
        super(FetchErrorType.PARSE_FAILURE, productId,
              "Could not extract a price for product '" + productId + "': " + detail, null);
    }
}
