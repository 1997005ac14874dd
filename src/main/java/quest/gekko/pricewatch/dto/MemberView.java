package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.MemberRole;

import java.time.Instant;

/**
 * Attributes of one group member at the moment a comparison was computed.
 */
public record MemberView(
        Long trackedProductId,
        String productId,
        MemberRole role,
        int position,
        String name,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Double averagePrice,
        Double discountIndex,
        Double rating,
        Integer reviewCount,
        Boolean available,
        String imageUrl,
        String productUrl,
        Instant lastFetchedAt) {

    public Double effectivePrice() {
        return cardPrice != null ? cardPrice : price;
    }
}
