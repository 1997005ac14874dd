package quest.gekko.pricewatch.dto;

import java.time.Instant;

public record UserComparisonStats(String ownerId, long totalGroups, long comparisonGroups, long totalProducts,
                                  Double avgCompetitivenessIndex, Instant lastComparisonAt) {}
