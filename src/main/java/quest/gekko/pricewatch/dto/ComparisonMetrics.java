package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.Grade;

import java.util.Map;

/**
 * Metrics of an own-versus-competitor comparison. A difference is null when either side
 * lacks the data. The index and grade are null only when no price is known.
 */
public record ComparisonMetrics(
        PriceDifference price,
        RatingDifference rating,
        DiscountDifference discount,
        ReviewsDifference reviews,
        Map<String, MetricScore> scores,
        Double competitivenessIndex,
        Grade grade,
        String overallRecommendation) {}
