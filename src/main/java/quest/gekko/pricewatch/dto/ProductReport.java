package quest.gekko.pricewatch.dto;

import java.time.Instant;
import java.util.List;

/**
 * One tracked product with its attempt counts and price statistics over a window.
 * {@code history} is null when it was not requested.
 */
public record ProductReport(
        String ownerId,
        String productId,
        TrackedProductView product,
        int days,
        long totalAttempts,
        long successfulAttempts,
        WindowAggregate window,
        WindowAggregate lastSevenDays,
        List<PriceSnapshotView> history,
        Instant generatedAt) {
}
