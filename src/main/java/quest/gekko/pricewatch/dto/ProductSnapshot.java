package quest.gekko.pricewatch.dto;

import java.time.Instant;

/**
 * Point-in-time public attributes of a product as returned by the fetch client.
 * {@code price} is the regular price, {@code cardPrice} the loyalty-card price and
 * {@code oldPrice} the crossed-out list price.
 */
public record ProductSnapshot(
        String productId,
        String name,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Double rating,
        Integer reviewCount,
        Boolean available,
        String imageUrl,
        String productUrl,
        String source,
        Instant fetchedAt,
        long durationMs) {

    public Double effectivePrice() {
        return cardPrice != null ? cardPrice : price;
    }
}
