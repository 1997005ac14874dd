package quest.gekko.pricewatch.exception;

public class ProductNotFoundException extends PriceWatchException {
    public ProductNotFoundException(String productId, Throwable cause) {
        super("PRODUCT_NOT_FOUND", "Product '" + productId + "' could not be resolved.", cause);
    }

    public ProductNotFoundException(String productId) {
        this(productId, null);
    }
}
