package quest.gekko.pricewatch.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.config.PriceWatchProperties;

import java.time.ZoneId;

/**
 * Registers a cron task for every job known to the {@link JobRunner}. All triggers go
 * through the runner so scheduled and manual runs share the same run-lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionScheduler implements SchedulingConfigurer {
    private static final String DISABLED = "-";

    private final JobRunner jobRunner;
    private final PriceWatchProperties.Collector collector;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        ZoneId zone = ZoneId.of(collector.zone());
        for (ScheduledJob job : jobRunner.jobs()) {
            if (DISABLED.equals(job.cron())) {
                log.info("Job {} has no schedule; manual runs only", job.name());
                continue;
            }
            registrar.addCronTask(new CronTask(() -> jobRunner.trigger(job.name()), new CronTrigger(job.cron(), zone)));
            log.info("Scheduled job {} with cron '{}' ({})", job.name(), job.cron(), zone);
        }
    }
}
