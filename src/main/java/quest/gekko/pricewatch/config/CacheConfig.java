package quest.gekko.pricewatch.config;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.pricewatch.service.fetch.ProductSnapshotCache;

@Configuration
public class CacheConfig {

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public ProductSnapshotCache productSnapshotCache(final PriceWatchProperties.Fetch fetch, final Ticker cacheTicker) {
        return new ProductSnapshotCache(fetch.cacheTtl(), fetch.cacheMaxSize(), cacheTicker);
    }
}
