package quest.gekko.pricewatch.exception;

import lombok.Getter;
import quest.gekko.pricewatch.domain.FetchErrorType;

/**
 * A failed read of a product page. The type tells callers whether retrying can help.
 */
@Getter
public abstract class FetchException extends PriceWatchException {
    private final FetchErrorType type;
    private final String productId;

    protected FetchException(FetchErrorType type, String productId, String message, Throwable cause) {
        super("FETCH_" + type.name(), message, cause);
        this.type = type;
        this.productId = productId;
    }

    public boolean isTransient() {
        return type.isTransient();
    }
}
