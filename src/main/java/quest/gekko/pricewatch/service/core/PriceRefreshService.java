package quest.gekko.pricewatch.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.dto.ProductSnapshot;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.service.fetch.FetchClient;
import quest.gekko.pricewatch.util.ProductIds;

import java.time.Clock;

/**
 * On-demand path for one product: live fetch, record the attempt, refresh aggregates.
 * The cache is always bypassed; a cached snapshot is already in the history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceRefreshService {
    private final FetchClient fetchClient;
    private final PriceHistoryService history;
    private final PriceAggregator aggregator;
    private final Clock clock;

    /**
     * The attempt is recorded whether it succeeds or not.
     *
     * @throws FetchException after the failed attempt has been stored
     */
    public PriceSnapshot refresh(String rawProductId) {
        String productId = ProductIds.normalize(rawProductId);
        long started = clock.millis();
        try {
            ProductSnapshot fetched = fetchClient.fetch(productId, true);
            PriceSnapshot stored = history.append(PriceHistoryService.success(fetched));
            aggregator.refresh(productId);
            return stored;
        } catch (FetchException e) {
            history.append(PriceHistoryService.failure(productId, e, clock.instant(), clock.millis() - started));
            aggregator.refresh(productId);
            throw e;
        }
    }
}
