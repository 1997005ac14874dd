package quest.gekko.pricewatch.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.ComparisonGroup;
import quest.gekko.pricewatch.domain.RunStatus;
import quest.gekko.pricewatch.dto.ComparisonResult;
import quest.gekko.pricewatch.exception.InsufficientMembersException;
import quest.gekko.pricewatch.exception.PriceWatchException;
import quest.gekko.pricewatch.repository.ComparisonGroupRepository;
import quest.gekko.pricewatch.service.comparison.ComparisonService;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recomputes every group once a day from stored attributes so comparison history accrues
 * without anyone asking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComparisonSnapshotJob implements ScheduledJob {
    public static final String NAME = "comparison-snapshots";

    private final ComparisonGroupRepository groups;
    private final ComparisonService comparisonService;
    private final PriceWatchProperties.Comparison props;
    private final Clock clock;

    @Override
    public String name() { return NAME; }

    @Override
    public String cron() { return props.snapshotCron(); }

    @Override
    public JobReport run() {
        Instant started = clock.instant();
        long snapshotted = 0, displayOnly = 0, skipped = 0, failed = 0;

        for (ComparisonGroup group : groups.findAll()) {
            try {
                ComparisonResult result = comparisonService.computeFromStored(group.getId());
                if (result.snapshotId() != null) snapshotted++;
                else displayOnly++;
            } catch (InsufficientMembersException e) {
                skipped++;
            } catch (PriceWatchException e) {
                failed++;
                log.warn("Scheduled comparison of group {} failed: {}", group.getId(), e.getMessage());
            }
        }

        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("snapshotted", snapshotted);
        counters.put("displayOnly", displayOnly);
        counters.put("skipped", skipped);
        counters.put("failed", failed);
        return JobReport.of(NAME, started, clock.instant(), failed > 0 ? RunStatus.DEGRADED : RunStatus.COMPLETED, counters);
    }
}
