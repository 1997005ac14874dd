package quest.gekko.pricewatch.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.dto.FetchStats;
import quest.gekko.pricewatch.dto.ProductSnapshot;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.ParseFailureException;
import quest.gekko.pricewatch.exception.RemoteRateLimitException;
import quest.gekko.pricewatch.service.integration.connector.ProductSource;
import quest.gekko.pricewatch.service.integration.extract.ExtractedAttributes;
import quest.gekko.pricewatch.service.integration.extract.Extractor;
import quest.gekko.pricewatch.util.ProductIds;
import quest.gekko.pricewatch.util.RateLimiter;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads the current public attributes of a product: cache first, then a rate-limited,
 * retried page fetch run through the extraction strategies in order.
 */
@Service
@Slf4j
public class FetchClient {
    private final ProductSource source;
    private final List<Extractor> extractors;
    private final ProductSnapshotCache cache;
    private final RateLimiter rateLimiter;
    private final RetryTemplate retryTemplate;
    private final Sleeper sleeper;
    private final PriceWatchProperties.Fetch props;
    private final Clock clock;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    public FetchClient(ProductSource source, List<Extractor> extractors, ProductSnapshotCache cache,
                       RateLimiter rateLimiter, RetryTemplate retryTemplate, Sleeper sleeper,
                       PriceWatchProperties.Fetch props, Clock clock) {
        this.source = source;
        this.extractors = List.copyOf(extractors);
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.retryTemplate = retryTemplate;
        this.sleeper = sleeper;
        this.props = props;
        this.clock = clock;
    }

    public ProductSnapshot fetch(String productId) {
        return fetch(productId, false);
    }

    /**
     * @param skipCache bypass the cache read; a successful result still replaces the cached entry
     * @throws IllegalArgumentException if the identifier is malformed
     * @throws FetchException when every attempt failed
     */
    public ProductSnapshot fetch(String rawProductId, boolean skipCache) {
        String productId = ProductIds.normalize(rawProductId);
        requests.incrementAndGet();

        if (!skipCache) {
            Optional<ProductSnapshot> cached = cache.get(productId);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                return cached.get();
            }
        }
        cacheMisses.incrementAndGet();

        try {
            ProductSnapshot snapshot = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    retries.incrementAndGet();
                    if (context.getLastThrowable() instanceof RemoteRateLimitException) {
                        pause(productId);
                    }
                }
                rateLimiter.acquire();
                return fetchOnce(productId);
            });
            cache.put(productId, snapshot);
            successes.incrementAndGet();
            return snapshot;
        } catch (FetchException e) {
            failures.incrementAndGet();
            log.info("Fetch of {} failed with {}: {}", productId, e.getType(), e.getMessage());
            throw e;
        }
    }

    public FetchStats stats() {
        return new FetchStats(requests.get(), cacheHits.get(), cacheMisses.get(), successes.get(),
                failures.get(), retries.get(), cache.size());
    }

    private ProductSnapshot fetchOnce(String productId) {
        long started = clock.millis();
        String page = source.fetchPage(productId);
        Document document = Jsoup.parse(page, source.productUrl(productId));

        for (Extractor extractor : extractors) {
            Optional<ExtractedAttributes> found;
            try {
                found = extractor.extract(document);
            } catch (RuntimeException e) {
                log.warn("Extractor {} failed on {}: {}", extractor.name(), productId, e.toString());
                continue;
            }
            if (found.isPresent() && found.get().hasPlausiblePrice()) {
                log.debug("Extracted {} with {}", productId, extractor.name());
                return toSnapshot(productId, found.get().sanitized(), extractor.name(), started);
            }
        }
        throw new ParseFailureException(productId, "no extraction strategy found a price");
    }

    private ProductSnapshot toSnapshot(String productId, ExtractedAttributes a, String strategy, long started) {
        Instant now = clock.instant();
        return new ProductSnapshot(
                productId,
                a.name(),
                a.price(),
                a.cardPrice(),
                a.oldPrice(),
                a.rating(),
                a.reviewCount(),
                a.available(),
                a.imageUrl(),
                a.productUrl() != null ? a.productUrl() : source.productUrl(productId),
                strategy,
                now,
                Math.max(0, now.toEpochMilli() - started));
    }

    private void pause(String productId) {
        long millis = props.remoteRateLimitPenalty().toMillis();
        log.info("Remote rate limit hit for {}, pausing {} ms", productId, millis);
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off from remote rate limit", e);
        }
    }
}
