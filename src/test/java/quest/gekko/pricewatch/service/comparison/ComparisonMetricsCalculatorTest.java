package quest.gekko.pricewatch.service.comparison;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;
import quest.gekko.pricewatch.TestProperties;
import quest.gekko.pricewatch.domain.Grade;
import quest.gekko.pricewatch.domain.MemberRole;
import quest.gekko.pricewatch.dto.ComparisonMetrics;
import quest.gekko.pricewatch.dto.MemberView;
import quest.gekko.pricewatch.dto.PriceDifference;
import quest.gekko.pricewatch.dto.RatingDifference;
import quest.gekko.pricewatch.dto.ReviewsDifference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComparisonMetricsCalculatorTest {
    private final ComparisonMetricsCalculator calculator = new ComparisonMetricsCalculator(TestProperties.comparison());

    @Test
    void priceDifference_ownCheaper() {
        PriceDifference d = calculator.priceDifference(1800.0, 2000.0);

        assertThat(d.absolute()).isEqualTo(-200.0);
        assertThat(d.percentage()).isEqualTo(-10.0);
        assertThat(d.whoCheaper()).isEqualTo("own");
        assertThat(d.recommendation()).isEqualTo("Your price is 10.0% lower");
    }

    @Test
    void priceDifference_muchHigher_recommendsLowering() {
        PriceDifference d = calculator.priceDifference(2500.0, 2000.0);

        assertThat(d.whoCheaper()).isEqualTo("competitor");
        assertThat(d.recommendation()).isEqualTo("Your price is 25.0% higher; consider lowering price");
    }

    @Test
    void priceDifference_missingSide_isNull() {
        assertThat(calculator.priceDifference(null, 2000.0)).isNull();
        assertThat(calculator.priceDifference(1800.0, 0.0)).isNull();
    }

    @Test
    void ratingDifference_competitorBetter() {
        RatingDifference d = calculator.ratingDifference(4.5, 4.7);

        assertThat(d.absolute()).isEqualTo(-0.2);
        assertThat(d.whoBetter()).isEqualTo("competitor");
        assertThat(d.recommendation()).startsWith("Your rating is 0.20 lower");
    }

    @Test
    void reviewsDifference_farFewer_encouragesReviews() {
        ReviewsDifference d = calculator.reviewsDifference(40, 200);

        assertThat(d.absolute()).isEqualTo(-160);
        assertThat(d.percentage()).isEqualTo(-80.0);
        assertThat(d.whoMore()).isEqualTo("competitor");
        assertThat(d.recommendation()).startsWith("Encourage reviews");
    }

    @Test
    void grade_boundariesAreInclusive() {
        assertThat(Grade.of(0.85, TestProperties.grades())).isEqualTo(Grade.A);
        assertThat(Grade.of(0.849999, TestProperties.grades())).isEqualTo(Grade.B);
        assertThat(Grade.of(0.5, TestProperties.grades())).isEqualTo(Grade.C);
        assertThat(Grade.of(0.29, TestProperties.grades())).isEqualTo(Grade.F);
    }

    @Test
    void compute_weightsAllMetrics() {
        MemberView own = member(MemberRole.OWN, 1800.0, 4.5, 100, true);
        MemberView competitor = member(MemberRole.COMPETITOR, 2000.0, 4.7, 300, true);

        ComparisonMetrics m = calculator.compute(own, competitor);

        assertThat(m.scores().get("price").value()).isCloseTo(0.75, within(1e-9));
        assertThat(m.scores().get("rating").value()).isCloseTo(0.4, within(1e-9));
        assertThat(m.scores().get("reviews").value()).isCloseTo(0.25, within(1e-9));
        assertThat(m.competitivenessIndex()).isCloseTo(0.5375, within(1e-9));
        assertThat(m.grade()).isEqualTo(Grade.C);
        assertThat(m.overallRecommendation()).startsWith("Grade C:").contains("reviews");
    }

    @Test
    void compute_indexOnThreshold_earnsThatGrade() {
        MemberView own = member(MemberRole.OWN, 2400.0, 5.0, 10, true);
        MemberView competitor = member(MemberRole.COMPETITOR, 2000.0, 4.0, 0, true);

        ComparisonMetrics m = calculator.compute(own, competitor);

        assertThat(m.scores().get("price").value()).isZero();
        assertThat(m.scores().get("rating").value()).isEqualTo(1.0);
        assertThat(m.scores().get("reviews").value()).isEqualTo(1.0);
        assertThat(m.competitivenessIndex()).isEqualTo(0.5);
        assertThat(m.grade()).isEqualTo(Grade.C);
    }

    @Test
    void compute_indexStaysInUnitRange() {
        MemberView own = member(MemberRole.OWN, 5000.0, 1.0, 0, false);
        MemberView competitor = member(MemberRole.COMPETITOR, 1000.0, 5.0, 900, true);

        ComparisonMetrics m = calculator.compute(own, competitor);

        assertThat(m.competitivenessIndex()).isBetween(0.0, 1.0);
        assertThat(m.grade()).isEqualTo(Grade.F);
        assertThat(m.scores().get("availability").value()).isZero();
    }

    @Test
    void compute_onlyPriceKnown_othersAreNeutral() {
        MemberView own = member(MemberRole.OWN, 1000.0, null, null, null);
        MemberView competitor = member(MemberRole.COMPETITOR, 1000.0, null, null, null);

        ComparisonMetrics m = calculator.compute(own, competitor);

        assertThat(m.rating()).isNull();
        assertThat(m.reviews()).isNull();
        assertThat(m.scores().get("rating").known()).isFalse();
        assertThat(m.competitivenessIndex()).isCloseTo(0.5, within(1e-9));
        assertThat(m.overallRecommendation()).contains("match or beat");
    }

    @Test
    void compute_priceUnknown_hasNoIndex() {
        MemberView own = member(MemberRole.OWN, null, 4.5, 10, true);
        MemberView competitor = member(MemberRole.COMPETITOR, 1000.0, 4.0, 10, true);

        ComparisonMetrics m = calculator.compute(own, competitor);

        assertThat(m.price()).isNull();
        assertThat(m.competitivenessIndex()).isNull();
        assertThat(m.grade()).isNull();
        assertThat(m.overallRecommendation()).startsWith("Not enough data");
    }

    @Test
    void metrics_surviveJsonRoundTrip() throws Exception {
        ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
        ComparisonMetrics m = calculator.compute(
                member(MemberRole.OWN, 1800.0, 4.5, 100, true),
                member(MemberRole.COMPETITOR, 2000.0, 4.7, 300, true));

        ComparisonMetrics read = mapper.readValue(mapper.writeValueAsString(m), ComparisonMetrics.class);

        assertThat(read).isEqualTo(m);
    }

    static MemberView member(MemberRole role, Double price, Double rating, Integer reviews, Boolean available) {
        return new MemberView(1L, role == MemberRole.OWN ? "111111111" : "222222222", role, 0, "Product",
                price, null, null, price, price != null ? 0.0 : null, rating, reviews, available,
                null, null, null);
    }
}
