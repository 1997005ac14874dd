package quest.gekko.pricewatch.dto;

/** Difference in discount index, in percentage points; percentage is null when the competitor has none. */
public record DiscountDifference(double ownDiscount, double competitorDiscount, double absolute, Double percentage,
                                 String whoDeeper, String recommendation) {}
