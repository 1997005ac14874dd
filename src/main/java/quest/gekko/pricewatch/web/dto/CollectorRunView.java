package quest.gekko.pricewatch.web.dto;

import quest.gekko.pricewatch.domain.CollectorRun;
import quest.gekko.pricewatch.domain.RunStatus;

import java.time.Instant;

public record CollectorRunView(Long id, String jobName, Instant startedAt, Instant finishedAt, int attempted,
                               int succeeded, int failed, int storageErrors, RunStatus status) {

    public static CollectorRunView of(CollectorRun r) {
        return new CollectorRunView(r.getId(), r.getJobName(), r.getStartedAt(), r.getFinishedAt(), r.getAttempted(),
                r.getSucceeded(), r.getFailed(), r.getStorageErrors(), r.getStatus());
    }
}
