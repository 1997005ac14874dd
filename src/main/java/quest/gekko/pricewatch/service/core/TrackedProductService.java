package quest.gekko.pricewatch.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.DiscountMetrics;
import quest.gekko.pricewatch.dto.ProductSnapshot;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.ProductNotFoundException;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.service.fetch.FetchClient;
import quest.gekko.pricewatch.util.ProductIds;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrackedProductService {
    private final TrackedProductRepository repository;
    private final FetchClient fetchClient;
    private final PriceRefreshService refresher;
    private final PriceHistoryService history;
    private final PriceAggregator aggregator;
    private final DiscountCalculator discountCalculator;
    private final Clock clock;

    /**
     * Starts tracking a product for an owner. Registering it again returns the existing row,
     * reactivated if it had been switched off.
     */
    public TrackedProduct register(String ownerId, String rawProductId, boolean fetchNow) {
        TrackedProduct product = resolve(ownerId, rawProductId, fetchNow);
        if (product.getStatus() != ProductStatus.ACTIVE) {
            log.info("Reactivating {} for owner {}", product.getProductId(), ownerId);
            product.setStatus(ProductStatus.ACTIVE);
            product = repository.save(product);
        }
        return product;
    }

    /**
     * Finds the owner's row for the identifier or creates it. With {@code scrapeNow} a new
     * product, or one that has never been priced, is fetched live first; if that fails nothing
     * is written and {@link ProductNotFoundException} is thrown.
     */
    public TrackedProduct resolve(String ownerId, String rawProductId, boolean scrapeNow) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        String productId = ProductIds.normalize(rawProductId);

        var existing = repository.findByOwnerIdAndProductId(ownerId, productId);
        if (existing.isPresent()) {
            TrackedProduct product = existing.get();
            if (!scrapeNow || product.hasPrice()) return product;
            try {
                refresher.refresh(productId);
            } catch (FetchException e) {
                throw new ProductNotFoundException(productId, e);
            }
            return reload(product);
        }

        ProductSnapshot fetched = null;
        if (scrapeNow) {
            try {
                fetched = fetchClient.fetch(productId, true);
            } catch (FetchException e) {
                throw new ProductNotFoundException(productId, e);
            }
        }

        TrackedProduct product = new TrackedProduct();
        product.setOwnerId(ownerId);
        product.setProductId(productId);
        product.setCreatedAt(clock.instant());
        try {
            product = repository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            // Registered concurrently by another request
            return repository.findByOwnerIdAndProductId(ownerId, productId).orElseThrow(() -> e);
        }
        log.info("Now tracking {} for owner {}", productId, ownerId);

        if (fetched != null) {
            history.append(PriceHistoryService.success(fetched));
            aggregator.refresh(productId);
            product = reload(product);
        }
        return product;
    }

    @Transactional(readOnly = true)
    public List<TrackedProduct> listByOwner(String ownerId) {
        return repository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Transactional
    public TrackedProduct updateStatus(Long id, ProductStatus status) {
        TrackedProduct product = repository.findById(id)
                .orElseThrow(() -> new ProductNotFoundException(String.valueOf(id)));
        product.setStatus(status);
        log.info("Product {} (owner {}) is now {}", product.getProductId(), product.getOwnerId(), status);
        return repository.save(product);
    }

    @Transactional(readOnly = true)
    public DiscountMetrics discount(String rawProductId) {
        String productId = ProductIds.normalize(rawProductId);
        return repository.findByProductId(productId).stream()
                .findFirst()
                .map(discountCalculator::compute)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private TrackedProduct reload(TrackedProduct product) {
        return repository.findById(product.getId()).orElse(product);
    }
}
