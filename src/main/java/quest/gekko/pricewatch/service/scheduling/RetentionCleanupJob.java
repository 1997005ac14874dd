package quest.gekko.pricewatch.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.RunStatus;
import quest.gekko.pricewatch.repository.CollectorRunRepository;
import quest.gekko.pricewatch.repository.ComparisonSnapshotRepository;
import quest.gekko.pricewatch.service.core.PriceHistoryService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionCleanupJob implements ScheduledJob {
    public static final String NAME = "retention-cleanup";

    private final PriceHistoryService history;
    private final ComparisonSnapshotRepository comparisonSnapshots;
    private final CollectorRunRepository runs;
    private final PriceWatchProperties.Retention props;
    private final Clock clock;

    @Override
    public String name() { return NAME; }

    @Override
    public String cron() { return props.cron(); }

    @Override
    @Transactional
    public JobReport run() {
        Instant started = clock.instant();
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("priceSnapshots", (long) history.prune(props.priceHistoryDays()));
        counters.put("comparisonSnapshots",
                (long) comparisonSnapshots.deleteOlderThan(started.minus(Duration.ofDays(props.comparisonSnapshotDays()))));
        counters.put("collectorRuns", (long) runs.deleteOlderThan(started.minus(Duration.ofDays(props.runLogDays()))));
        log.info("Retention cleanup removed {}", counters);
        return JobReport.of(NAME, started, clock.instant(), RunStatus.COMPLETED, counters);
    }
}
