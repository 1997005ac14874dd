package quest.gekko.pricewatch.service.comparison;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.Grade;
import quest.gekko.pricewatch.dto.ComparisonMetrics;
import quest.gekko.pricewatch.dto.DiscountDifference;
import quest.gekko.pricewatch.dto.MemberView;
import quest.gekko.pricewatch.dto.MetricScore;
import quest.gekko.pricewatch.dto.PriceDifference;
import quest.gekko.pricewatch.dto.RatingDifference;
import quest.gekko.pricewatch.dto.ReviewsDifference;
import quest.gekko.pricewatch.util.Numbers;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Locale.ROOT;

/**
 * Own-versus-competitor metrics. Pure: the same two member views always give the same result.
 */
@Component
@RequiredArgsConstructor
public class ComparisonMetricsCalculator {
    static final String OWN = "own";
    static final String COMPETITOR = "competitor";
    static final String EQUAL = "equal";

    static final String PRICE = "price";
    static final String RATING = "rating";
    static final String DISCOUNT = "discount";
    static final String REVIEWS = "reviews";
    static final String AVAILABILITY = "availability";

    static final int INDEX_SCALE = 6;

    private final PriceWatchProperties.Comparison props;

    public ComparisonMetrics compute(MemberView own, MemberView competitor) {
        PriceDifference price = priceDifference(own.effectivePrice(), competitor.effectivePrice());
        RatingDifference rating = ratingDifference(own.rating(), competitor.rating());
        DiscountDifference discount = discountDifference(own.discountIndex(), competitor.discountIndex());
        ReviewsDifference reviews = reviewsDifference(own.reviewCount(), competitor.reviewCount());

        Map<String, MetricScore> scores = new LinkedHashMap<>();
        scores.put(PRICE, priceScore(own.effectivePrice(), competitor.effectivePrice()));
        scores.put(RATING, spreadScore(own.rating(), competitor.rating(), props.spreads().rating()));
        scores.put(DISCOUNT, spreadScore(own.discountIndex(), competitor.discountIndex(), props.spreads().discount()));
        scores.put(REVIEWS, reviewsScore(own.reviewCount(), competitor.reviewCount()));
        scores.put(AVAILABILITY, availabilityScore(own.available(), competitor.available()));

        if (!scores.get(PRICE).known()) {
            return new ComparisonMetrics(price, rating, discount, reviews, scores, null, null,
                    "Not enough data: the price of one side is unknown.");
        }
        double index = competitivenessIndex(scores);
        Grade grade = Grade.of(index, props.grades());
        return new ComparisonMetrics(price, rating, discount, reviews, scores, index, grade,
                overallRecommendation(grade, scores));
    }

    public PriceDifference priceDifference(Double own, Double competitor) {
        if (own == null || competitor == null || competitor <= 0) return null;
        double absolute = Numbers.round(own - competitor, 2);
        double percentage = Numbers.round((own - competitor) / competitor * 100, 2);
        String cheaper = own < competitor ? OWN : own > competitor ? COMPETITOR : EQUAL;

        String recommendation;
        if (Math.abs(percentage) < 1) {
            recommendation = "Prices are roughly equal";
        } else if (percentage > 10) {
            recommendation = format(ROOT, "Your price is %.1f%% higher; consider lowering price", percentage);
        } else if (percentage > 0) {
            recommendation = "Your price is slightly higher, the gap is small";
        } else {
            recommendation = format(ROOT, "Your price is %.1f%% lower", -percentage);
        }
        return new PriceDifference(own, competitor, absolute, percentage, cheaper, recommendation);
    }

    public RatingDifference ratingDifference(Double own, Double competitor) {
        if (own == null || competitor == null) return null;
        double absolute = Numbers.round(own - competitor, 2);
        double percentage = competitor > 0 ? Numbers.round((own - competitor) / competitor * 100, 2) : 0.0;
        String better = own > competitor ? OWN : own < competitor ? COMPETITOR : EQUAL;

        String recommendation;
        if (Math.abs(absolute) < 0.1) {
            recommendation = "Ratings are roughly equal";
        } else if (absolute > 0) {
            recommendation = format(ROOT, "Your rating is %.2f higher", absolute);
        } else {
            recommendation = format(ROOT, "Your rating is %.2f lower; work on product quality", -absolute);
        }
        return new RatingDifference(own, competitor, absolute, percentage, better, recommendation);
    }

    /** Both inputs are discount indices in percent; the difference is in percentage points. */
    public DiscountDifference discountDifference(Double own, Double competitor) {
        if (own == null || competitor == null) return null;
        double absolute = Numbers.round(own - competitor, 2);
        Double percentage = competitor != 0 ? Numbers.round((own - competitor) / Math.abs(competitor) * 100, 2) : null;
        String deeper = own > competitor ? OWN : own < competitor ? COMPETITOR : EQUAL;

        String recommendation;
        if (Math.abs(absolute) < 1) {
            recommendation = "Discounts are comparable";
        } else if (absolute > 0) {
            recommendation = format(ROOT, "Your discount is %.1f pp deeper", absolute);
        } else if (absolute < -5) {
            recommendation = format(ROOT, "The competitor discounts %.1f pp deeper; consider a promotion", -absolute);
        } else {
            recommendation = "The competitor discounts slightly deeper";
        }
        return new DiscountDifference(own, competitor, absolute, percentage, deeper, recommendation);
    }

    public ReviewsDifference reviewsDifference(Integer own, Integer competitor) {
        if (own == null || competitor == null) return null;
        int absolute = own - competitor;
        Double percentage = competitor > 0 ? Numbers.round((double) absolute / competitor * 100, 2) : null;
        String more = absolute > 0 ? OWN : absolute < 0 ? COMPETITOR : EQUAL;

        String recommendation;
        if (absolute == 0) {
            recommendation = "Review counts are equal";
        } else if (absolute > 0) {
            recommendation = format(ROOT, "You have %d more reviews", absolute);
        } else if (percentage != null && percentage < -50) {
            recommendation = format(ROOT, "Encourage reviews: you have %.0f%% fewer", -percentage);
        } else {
            recommendation = format(ROOT, "The competitor has %d more reviews", -absolute);
        }
        return new ReviewsDifference(own, competitor, absolute, percentage, more, recommendation);
    }

    /**
     * Weighted mean of the scores, unknown metrics included at 0.5, clamped to [0, 1] and rounded
     * to {@value #INDEX_SCALE} places so an index that lands on a grade threshold earns that grade.
     */
    public double competitivenessIndex(Map<String, MetricScore> scores) {
        PriceWatchProperties.Weights w = props.weights();
        double sum = w.price() * value(scores, PRICE)
                + w.rating() * value(scores, RATING)
                + w.discount() * value(scores, DISCOUNT)
                + w.reviews() * value(scores, REVIEWS)
                + w.availability() * value(scores, AVAILABILITY);
        double total = w.total();
        if (total <= 0) return MetricScore.NEUTRAL;
        return Numbers.clamp(Numbers.round(sum / total, INDEX_SCALE), 0.0, 1.0);
    }

    MetricScore priceScore(Double own, Double competitor) {
        if (own == null || competitor == null || competitor <= 0) return MetricScore.unknown();
        double relative = (own - competitor) / competitor;
        return MetricScore.of(0.5 - relative / (2 * props.spreads().price()));
    }

    static MetricScore spreadScore(Double own, Double competitor, double spread) {
        if (own == null || competitor == null) return MetricScore.unknown();
        return MetricScore.of(0.5 + (own - competitor) / (2 * spread));
    }

    static MetricScore reviewsScore(Integer own, Integer competitor) {
        if (own == null || competitor == null || own + competitor == 0) return MetricScore.unknown();
        return MetricScore.of((double) own / (own + competitor));
    }

    static MetricScore availabilityScore(Boolean own, Boolean competitor) {
        if (own == null || competitor == null) return MetricScore.unknown();
        if (own.equals(competitor)) return MetricScore.of(0.5);
        return MetricScore.of(own ? 1.0 : 0.0);
    }

    private String overallRecommendation(Grade grade, Map<String, MetricScore> scores) {
        Optional<Map.Entry<String, MetricScore>> worst = scores.entrySet().stream()
                .filter(e -> e.getValue().known() && e.getValue().value() < MetricScore.NEUTRAL)
                .min(Comparator.comparingDouble(e -> e.getValue().value()));

        String advice = worst.map(e -> switch (e.getKey()) {
            case PRICE -> "your price is the primary disadvantage; consider a 5-10% reduction.";
            case RATING -> "your rating is the primary disadvantage; work on product quality and service.";
            case DISCOUNT -> "the competitor's discount is deeper; consider a promotion or card price.";
            case REVIEWS -> "the competitor has more reviews; encourage buyers to leave feedback.";
            default -> "your product is out of stock while the competitor's is available; restock.";
        }).orElse("you match or beat the competitor on every known metric.");
        return "Grade " + grade + ": " + advice;
    }

    private static double value(Map<String, MetricScore> scores, String key) {
        MetricScore score = scores.get(key);
        return score != null ? score.value() : MetricScore.NEUTRAL;
    }
}
