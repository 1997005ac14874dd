package quest.gekko.pricewatch.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.dto.ProductSnapshot;
import quest.gekko.pricewatch.dto.WindowAggregate;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.repository.PriceSnapshotRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only price history. Window statistics are always computed from the raw rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryService {
    private static final int MAX_ERROR_MESSAGE = 1000;

    private final PriceSnapshotRepository repository;
    private final Clock clock;

    @Transactional
    public PriceSnapshot append(PriceSnapshot snapshot) {
        if (snapshot.getId() != null) {
            throw new IllegalArgumentException("Price snapshots are insert-only, got id " + snapshot.getId());
        }
        if (snapshot.getCapturedAt() == null) snapshot.setCapturedAt(clock.instant());
        return repository.save(snapshot);
    }

    public static PriceSnapshot success(ProductSnapshot fetched) {
        PriceSnapshot s = new PriceSnapshot();
        s.setProductId(fetched.productId());
        s.setCapturedAt(fetched.fetchedAt());
        s.setName(truncate(fetched.name(), 500));
        s.setPrice(fetched.price());
        s.setCardPrice(fetched.cardPrice());
        s.setOldPrice(fetched.oldPrice());
        s.setAvailable(fetched.available());
        s.setRating(fetched.rating());
        s.setReviewCount(fetched.reviewCount());
        s.setImageUrl(truncate(fetched.imageUrl(), 1000));
        s.setProductUrl(truncate(fetched.productUrl(), 1000));
        s.setSource(fetched.source());
        s.setDurationMs(fetched.durationMs());
        s.setSuccess(true);
        return s;
    }

    public static PriceSnapshot failure(String productId, FetchException error, Instant capturedAt, long durationMs) {
        PriceSnapshot s = new PriceSnapshot();
        s.setProductId(productId);
        s.setCapturedAt(capturedAt);
        s.setSuccess(false);
        s.setErrorType(error.getType());
        s.setErrorMessage(truncate(error.getMessage(), MAX_ERROR_MESSAGE));
        s.setDurationMs(durationMs);
        return s;
    }

    /**
     * Statistics over the successful snapshots of the last {@code days} days.
     * Returns {@link WindowAggregate#empty()} rather than zeros when there are none.
     */
    @Transactional(readOnly = true)
    public WindowAggregate queryWindow(String productId, int days) {
        requirePositive("days", days);
        WindowAggregate result = repository.aggregateSince(productId, since(days));
        return result == null || result.isEmpty() ? WindowAggregate.empty() : result;
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<PriceSnapshot> queryRecent(String productId, int days, int limit, boolean includeFailed) {
        requirePositive("days", days);
        requirePositive("limit", limit);
        PageRequest page = PageRequest.of(0, limit);
        return includeFailed
                ? repository.findByProductIdAndCapturedAtGreaterThanEqualOrderByCapturedAtDesc(productId, since(days), page)
                : repository.findByProductIdAndSuccessTrueAndCapturedAtGreaterThanEqualOrderByCapturedAtDesc(productId, since(days), page);
    }

    /** Attempts in the last {@code days} days, all of them or only the successful ones. */
    @Transactional(readOnly = true)
    public long countAttempts(String productId, int days, boolean successfulOnly) {
        requirePositive("days", days);
        return successfulOnly
                ? repository.countByProductIdAndSuccessTrueAndCapturedAtGreaterThanEqual(productId, since(days))
                : repository.countByProductIdAndCapturedAtGreaterThanEqual(productId, since(days));
    }

    @Transactional(readOnly = true)
    public List<PriceSnapshot> latestAttempts(String productId, int count) {
        requirePositive("count", count);
        return repository.findByProductIdOrderByCapturedAtDesc(productId, PageRequest.of(0, count));
    }

    /** Deletes snapshots older than the horizon. Running it twice deletes nothing the second time. */
    @Transactional
    public int prune(int olderThanDays) {
        requirePositive("olderThanDays", olderThanDays);
        int deleted = repository.deleteOlderThan(since(olderThanDays));
        log.info("Pruned {} price snapshots older than {} days", deleted, olderThanDays);
        return deleted;
    }

    private Instant since(int days) {
        return clock.instant().minus(Duration.ofDays(days));
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) throw new IllegalArgumentException(name + " must be at least 1, got " + value);
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
