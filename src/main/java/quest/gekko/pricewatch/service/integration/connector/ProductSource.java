package quest.gekko.pricewatch.service.integration.connector;

/**
 * Raw access to the public product page of the marketplace.
 */
public interface ProductSource {

    /**
     * Returns the page body. Failures are reported as {@link quest.gekko.pricewatch.exception.FetchException}
     * subtypes so the caller can decide whether to retry.
     */
    String fetchPage(String productId);

    String productUrl(String productId);
}
