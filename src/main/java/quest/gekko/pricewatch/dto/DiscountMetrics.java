package quest.gekko.pricewatch.dto;

/**
 * Discount percentages of one product, each null when its inputs are missing.
 *
 * @param listDiscount  how far the regular price sits below the rolling average
 * @param cardDiscount  how far the card price sits below the regular price
 * @param discountIndex how far the effective price sits below the rolling average
 */
public record DiscountMetrics(String productId, Double averagePrice, Double listDiscount,
                              Double cardDiscount, Double discountIndex) {}
