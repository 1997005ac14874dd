package quest.gekko.pricewatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for fetching, collection, aggregation and comparison
 */
@Configuration
@EnableConfigurationProperties({
        PriceWatchProperties.Fetch.class,
        PriceWatchProperties.Collector.class,
        PriceWatchProperties.Aggregate.class,
        PriceWatchProperties.Comparison.class,
        PriceWatchProperties.Retention.class
})
public class PriceWatchProperties {

    @ConfigurationProperties("pricewatch.fetch")
    public record Fetch(
            @DefaultValue("https://www.ozon.ru") String baseUrl,
            @DefaultValue("/product/{id}/") String productPath,
            @DefaultValue("Mozilla/5.0 (X11; Linux x86_64) PriceWatch/1.0") String userAgent,
            @DefaultValue("20s") Duration timeout,
            @DefaultValue("3600s") Duration cacheTtl,
            @DefaultValue("10000") long cacheMaxSize,
            @DefaultValue("30") int rateLimit,
            @DefaultValue("60s") Duration rateWindow,
            @DefaultValue("4") int maxAttempts,
            @DefaultValue("1s") Duration backoffInitial,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("10s") Duration backoffMax,
            @DefaultValue("5s") Duration remoteRateLimitPenalty) {}

    @ConfigurationProperties("pricewatch.collector")
    public record Collector(
            @DefaultValue("0 0 3 * * *") String cron,
            @DefaultValue("UTC") String zone,
            @DefaultValue("10") int batchSize,
            @DefaultValue("2s") Duration minDelay,
            @DefaultValue("5s") Duration maxDelay) {}

    @ConfigurationProperties("pricewatch.aggregate")
    public record Aggregate(
            @DefaultValue("7") int windowDays,
            @DefaultValue("3") int problematicAfterFailures) {}

    @ConfigurationProperties("pricewatch.comparison")
    public record Comparison(
            @DefaultValue("1h") Duration freshness,
            @DefaultValue("0 0 4 * * *") String snapshotCron,
            @DefaultValue Weights weights,
            @DefaultValue Grades grades,
            @DefaultValue Spreads spreads) {}

    /** Relative weight of each metric in the competitiveness index. */
    public record Weights(
            @DefaultValue("0.35") double price,
            @DefaultValue("0.25") double rating,
            @DefaultValue("0.20") double discount,
            @DefaultValue("0.10") double reviews,
            @DefaultValue("0.10") double availability) {

        public double total() {
            return price + rating + discount + reviews + availability;
        }
    }

    /** Lower bounds (inclusive) of each letter grade. */
    public record Grades(
            @DefaultValue("0.85") double a,
            @DefaultValue("0.70") double b,
            @DefaultValue("0.50") double c,
            @DefaultValue("0.30") double d) {}

    /**
     * Difference at which a metric score saturates at 0 or 1.
     * Price is a relative difference, rating is in stars, discount in percentage points.
     */
    public record Spreads(
            @DefaultValue("0.20") double price,
            @DefaultValue("1.0") double rating,
            @DefaultValue("20.0") double discount) {}

    @ConfigurationProperties("pricewatch.retention")
    public record Retention(
            @DefaultValue("30") int priceHistoryDays,
            @DefaultValue("90") int comparisonSnapshotDays,
            @DefaultValue("90") int runLogDays,
            @DefaultValue("0 30 5 * * SUN") String cron) {}
}
