package quest.gekko.pricewatch.exception;

import quest.gekko.pricewatch.domain.FetchErrorType;

public class SourceNotFoundException extends FetchException {
    public SourceNotFoundException(String productId) {
        super(FetchErrorType.NOT_FOUND, productId, "Product '" + productId + "' does not exist at the source.", null);
    }
}
