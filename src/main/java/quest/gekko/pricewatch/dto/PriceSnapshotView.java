package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.FetchErrorType;
import quest.gekko.pricewatch.domain.PriceSnapshot;

import java.time.Instant;

public record PriceSnapshotView(
        Long id,
        String productId,
        Instant capturedAt,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Boolean available,
        Double rating,
        Integer reviewCount,
        boolean success,
        FetchErrorType errorType,
        long durationMs) {

    public static PriceSnapshotView of(PriceSnapshot s) {
        return new PriceSnapshotView(s.getId(), s.getProductId(), s.getCapturedAt(), s.getPrice(),
                s.getCardPrice(), s.getOldPrice(), s.getAvailable(), s.getRating(), s.getReviewCount(),
                s.isSuccess(), s.getErrorType(), s.getDurationMs());
    }
}
