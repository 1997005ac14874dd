package quest.gekko.pricewatch.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.DiscountMetrics;
import quest.gekko.pricewatch.util.Numbers;

/**
 * Discount percentages relative to the rolling average and to the regular price.
 * All results are rounded to 2 decimals and null when an input is missing.
 */
@Component
public class DiscountCalculator {

    public DiscountMetrics compute(TrackedProduct product) {
        Double average = product.getAveragePrice();
        Double base = product.getLastPrice();
        Double card = product.getLastCardPrice();
        return new DiscountMetrics(
                product.getProductId(),
                average,
                listDiscount(average, base),
                cardDiscount(base, card),
                discountIndex(average, card != null ? card : base));
    }

    /** (average - base) / average * 100 */
    public Double listDiscount(Double average, Double base) {
        return belowPercent(average, base);
    }

    /** (base - card) / base * 100 */
    public Double cardDiscount(Double base, Double card) {
        return belowPercent(base, card);
    }

    /** (average - effective) / average * 100; negative when the product is pricier than usual. */
    public Double discountIndex(Double average, Double effective) {
        return belowPercent(average, effective);
    }

    private static Double belowPercent(Double reference, Double value) {
        if (reference == null || value == null || reference <= 0) return null;
        return Numbers.round((reference - value) / reference * 100, 2);
    }
}
