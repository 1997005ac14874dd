package quest.gekko.pricewatch.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.CollectorRun;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.RunStatus;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.TransportException;
import quest.gekko.pricewatch.repository.CollectorRunRepository;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.service.core.PriceAggregator;
import quest.gekko.pricewatch.service.core.PriceHistoryService;
import quest.gekko.pricewatch.service.fetch.FetchClient;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Daily pass over every active product: live fetch, one history row per product whatever the
 * outcome, then one aggregate refresh for everything processed. Items run one at a time with
 * a random pause between them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryCollector implements ScheduledJob {
    public static final String NAME = "price-history-collector";

    private final TrackedProductRepository products;
    private final FetchClient fetchClient;
    private final PriceHistoryService history;
    private final PriceAggregator aggregator;
    private final CollectorRunRepository runs;
    private final Sleeper sleeper;
    private final PriceWatchProperties.Collector props;
    private final Clock clock;

    @Override
    public String name() { return NAME; }

    @Override
    public String cron() { return props.cron(); }

    @Override
    public JobReport run() {
        Instant started = clock.instant();
        List<String> productIds = products.findDistinctProductIdsByStatus(ProductStatus.ACTIVE);
        int batchSize = Math.max(1, props.batchSize());
        log.info("Collecting prices for {} products in batches of {}", productIds.size(), batchSize);

        int attempted = 0, succeeded = 0, failed = 0, storageErrors = 0;
        boolean interrupted = false;

        for (int from = 0; from < productIds.size() && !interrupted; from += batchSize) {
            List<String> batch = productIds.subList(from, Math.min(from + batchSize, productIds.size()));
            for (String productId : batch) {
                attempted++;
                PriceSnapshot row = collect(productId);
                if (row.isSuccess()) succeeded++;
                else failed++;
                if (!store(row)) storageErrors++;

                if (attempted < productIds.size() && !pause()) {
                    interrupted = true;
                    break;
                }
            }
            log.info("Batch {}/{} done: {} ok, {} failed so far", from / batchSize + 1,
                    (productIds.size() + batchSize - 1) / batchSize, succeeded, failed);
        }

        List<String> processed = productIds.subList(0, attempted);
        aggregator.refreshAll(processed);

        RunStatus status = interrupted ? RunStatus.FAILED
                : storageErrors > 0 ? RunStatus.DEGRADED
                : RunStatus.COMPLETED;
        Instant finished = clock.instant();
        recordRun(started, finished, attempted, succeeded, failed, storageErrors, status);

        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("attempted", (long) attempted);
        counters.put("succeeded", (long) succeeded);
        counters.put("failed", (long) failed);
        counters.put("storageErrors", (long) storageErrors);
        return JobReport.of(NAME, started, finished, status, counters);
    }

    private PriceSnapshot collect(String productId) {
        long started = clock.millis();
        try {
            return PriceHistoryService.success(fetchClient.fetch(productId, true));
        } catch (FetchException e) {
            return PriceHistoryService.failure(productId, e, clock.instant(), clock.millis() - started);
        } catch (RuntimeException e) {
            log.error("Unexpected error collecting {}", productId, e);
            return PriceHistoryService.failure(productId, new TransportException(productId, e.toString(), e),
                    clock.instant(), clock.millis() - started);
        }
    }

    /** One retry on a storage failure; false if the row could not be written. */
    private boolean store(PriceSnapshot row) {
        try {
            history.append(row);
            return true;
        } catch (DataAccessException first) {
            log.warn("Storing snapshot of {} failed, retrying once: {}", row.getProductId(), first.getMessage());
            row.setId(null);
            try {
                history.append(row);
                return true;
            } catch (DataAccessException second) {
                log.error("Snapshot of {} lost after retry", row.getProductId(), second);
                return false;
            }
        }
    }

    private boolean pause() {
        long min = props.minDelay().toMillis();
        long max = Math.max(min, props.maxDelay().toMillis());
        long delay = min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Collector interrupted, stopping early");
            return false;
        }
    }

    private void recordRun(Instant started, Instant finished, int attempted, int succeeded, int failed,
                           int storageErrors, RunStatus status) {
        CollectorRun run = new CollectorRun();
        run.setJobName(NAME);
        run.setStartedAt(started);
        run.setFinishedAt(finished);
        run.setAttempted(attempted);
        run.setSucceeded(succeeded);
        run.setFailed(failed);
        run.setStorageErrors(storageErrors);
        run.setStatus(status);
        try {
            runs.save(run);
        } catch (DataAccessException e) {
            log.error("Could not record collector run: attempted={} succeeded={} failed={}", attempted, succeeded, failed, e);
        }
    }
}
