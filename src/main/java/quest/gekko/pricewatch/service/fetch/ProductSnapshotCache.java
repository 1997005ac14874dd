package quest.gekko.pricewatch.service.fetch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import quest.gekko.pricewatch.dto.ProductSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-process TTL cache of successful fetches, keyed by product identifier.
 * Entries are never refreshed in place; they expire {@code ttl} after being written.
 */
public class ProductSnapshotCache {
    private final Cache<String, ProductSnapshot> cache;

    public ProductSnapshotCache(final Duration ttl, final long maxSize, final Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    public Optional<ProductSnapshot> get(final String productId) {
        return Optional.ofNullable(cache.getIfPresent(productId));
    }

    public void put(final String productId, final ProductSnapshot snapshot) {
        cache.put(productId, snapshot);
    }

    public void invalidate(final String productId) {
        cache.invalidate(productId);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
