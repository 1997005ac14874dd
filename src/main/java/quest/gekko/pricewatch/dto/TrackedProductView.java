package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;

import java.time.Instant;

public record TrackedProductView(
        Long id,
        String ownerId,
        String productId,
        ProductStatus status,
        boolean problematic,
        String name,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Double rating,
        Integer reviewCount,
        Boolean available,
        Double averagePrice,
        Integer averageSampleCount,
        Instant lastFetchedAt,
        Instant averageComputedAt) {

    public static TrackedProductView of(TrackedProduct p) {
        return new TrackedProductView(p.getId(), p.getOwnerId(), p.getProductId(), p.getStatus(), p.isProblematic(),
                p.getName(), p.getLastPrice(), p.getLastCardPrice(), p.getLastOldPrice(), p.getLastRating(),
                p.getLastReviewCount(), p.getLastAvailable(), p.getAveragePrice(), p.getAverageSampleCount(),
                p.getLastFetchedAt(), p.getAverageComputedAt());
    }
}
