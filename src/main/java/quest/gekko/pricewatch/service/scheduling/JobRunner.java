package quest.gekko.pricewatch.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.exception.UnknownJobException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the job definitions and one run-lock per job. A trigger that arrives while the same
 * job is running is dropped, never queued.
 */
@Component
@Slf4j
public class JobRunner {
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private final Map<String, ReentrantLock> locks = new LinkedHashMap<>();

    public JobRunner(List<ScheduledJob> jobs) {
        for (ScheduledJob job : jobs) {
            if (this.jobs.putIfAbsent(job.name(), job) != null) {
                throw new IllegalStateException("Duplicate job name " + job.name());
            }
            locks.put(job.name(), new ReentrantLock());
        }
    }

    public Collection<ScheduledJob> jobs() {
        return Collections.unmodifiableCollection(jobs.values());
    }

    /**
     * Runs the job on the calling thread.
     *
     * @return the report, or empty when the job was already running and this trigger was skipped
     * @throws UnknownJobException if no job has that name
     */
    public Optional<JobReport> trigger(String name) {
        ScheduledJob job = jobs.get(name);
        if (job == null) throw new UnknownJobException(name);

        ReentrantLock lock = locks.get(name);
        if (!lock.tryLock()) {
            log.warn("Job {} is still running; trigger skipped", name);
            return Optional.empty();
        }
        try {
            log.info("Job {} started", name);
            JobReport report = job.run();
            log.info("Job {} finished with {} in {} ms: {}", name, report.status(), report.durationMs(), report.counters());
            return Optional.of(report);
        } catch (RuntimeException e) {
            log.error("Job {} failed", name, e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(String name) {
        ReentrantLock lock = locks.get(name);
        if (lock == null) throw new UnknownJobException(name);
        return lock.isLocked();
    }
}
