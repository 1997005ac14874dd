package quest.gekko.pricewatch.dto;

import java.time.Instant;
import java.util.List;

/**
 * Summary of everything one owner tracks. {@code products} is null when it was not requested.
 */
public record OwnerReport(
        String ownerId,
        int days,
        int totalProducts,
        int activeProducts,
        int problematicProducts,
        long totalAttempts,
        long successfulAttempts,
        List<TrackedProductView> products,
        Instant generatedAt) {
}
