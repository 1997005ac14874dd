package quest.gekko.pricewatch.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.WindowAggregate;
import quest.gekko.pricewatch.repository.PriceSnapshotRepository;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.util.Numbers;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Sole writer of the denormalized fields on {@link TrackedProduct}: the last known attributes,
 * the rolling window statistics and the problematic flag. Never touches price snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceAggregator {
    private final PriceHistoryService history;
    private final PriceSnapshotRepository snapshots;
    private final TrackedProductRepository products;
    private final PriceWatchProperties.Aggregate props;
    private final Clock clock;

    /**
     * Recomputes the window for one identifier and writes it onto every tracked row that
     * carries it. Calling it again without new snapshots writes the same values.
     */
    @Transactional
    public WindowAggregate refresh(String productId) {
        WindowAggregate window = history.queryWindow(productId, props.windowDays());
        List<TrackedProduct> tracked = products.findByProductId(productId);
        if (tracked.isEmpty()) return window;

        Optional<PriceSnapshot> latest = snapshots.findFirstByProductIdAndSuccessTrueOrderByCapturedAtDesc(productId);
        boolean problematic = isProblematic(productId);
        Instant now = clock.instant();

        for (TrackedProduct p : tracked) {
            latest.ifPresent(s -> copyLatest(s, p));
            p.setAveragePrice(Numbers.round(window.average(), 2));
            p.setMinPrice(window.min());
            p.setMaxPrice(window.max());
            p.setAverageSampleCount(window.sampleCount().intValue());
            p.setAverageComputedAt(now);
            if (p.isProblematic() != problematic) {
                log.info("Product {} (owner {}) {} problematic", productId, p.getOwnerId(), problematic ? "is now" : "is no longer");
            }
            p.setProblematic(problematic);
        }
        products.saveAll(tracked);
        return window;
    }

    /** Refreshes every active product. */
    public int refreshAll() {
        return refreshAll(products.findDistinctProductIdsByStatus(ProductStatus.ACTIVE));
    }

    /**
     * Refreshes the given identifiers one by one; a storage failure on one is logged and
     * the rest still run. Returns the number refreshed.
     */
    public int refreshAll(Collection<String> productIds) {
        int refreshed = 0;
        for (String productId : productIds) {
            try {
                refresh(productId);
                refreshed++;
            } catch (DataAccessException e) {
                log.error("Could not refresh aggregates for {}", productId, e);
            }
        }
        log.info("Refreshed aggregates for {}/{} products", refreshed, productIds.size());
        return refreshed;
    }

    private boolean isProblematic(String productId) {
        int threshold = props.problematicAfterFailures();
        List<PriceSnapshot> recent = history.latestAttempts(productId, threshold);
        return recent.size() >= threshold && recent.stream().noneMatch(PriceSnapshot::isSuccess);
    }

    private static void copyLatest(PriceSnapshot s, TrackedProduct p) {
        if (s.getName() != null) p.setName(s.getName());
        p.setLastPrice(s.getPrice());
        p.setLastCardPrice(s.getCardPrice());
        p.setLastOldPrice(s.getOldPrice());
        p.setLastRating(s.getRating());
        p.setLastReviewCount(s.getReviewCount());
        p.setLastAvailable(s.getAvailable());
        if (s.getImageUrl() != null) p.setImageUrl(s.getImageUrl());
        if (s.getProductUrl() != null) p.setProductUrl(s.getProductUrl());
        p.setLastFetchedAt(s.getCapturedAt());
    }
}
