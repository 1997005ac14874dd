package quest.gekko.pricewatch.service.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import quest.gekko.pricewatch.domain.FetchErrorType;
import quest.gekko.pricewatch.domain.PriceSnapshot;

import java.time.Instant;

@JsonPropertyOrder({ "productId", "capturedAt", "price", "cardPrice", "oldPrice", "available", "rating",
        "reviewCount", "success", "errorType" })
public record PriceHistoryCsvRow(
        String productId,
        Instant capturedAt,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Boolean available,
        Double rating,
        Integer reviewCount,
        boolean success,
        FetchErrorType errorType) {

    static PriceHistoryCsvRow of(PriceSnapshot s) {
        return new PriceHistoryCsvRow(s.getProductId(), s.getCapturedAt(), s.getPrice(), s.getCardPrice(),
                s.getOldPrice(), s.getAvailable(), s.getRating(), s.getReviewCount(), s.isSuccess(), s.getErrorType());
    }
}
