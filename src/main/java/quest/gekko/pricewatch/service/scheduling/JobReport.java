package quest.gekko.pricewatch.service.scheduling;

import quest.gekko.pricewatch.domain.RunStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record JobReport(String job, Instant startedAt, Instant finishedAt, long durationMs, RunStatus status,
                        Map<String, Long> counters) {

    public static JobReport of(String job, Instant startedAt, Instant finishedAt, RunStatus status,
                               Map<String, Long> counters) {
        return new JobReport(job, startedAt, finishedAt, Duration.between(startedAt, finishedAt).toMillis(),
                status, Map.copyOf(counters));
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }
}
