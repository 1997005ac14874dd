package quest.gekko.pricewatch.service.scheduling;

/**
 * A named unit of background work with its cron trigger.
 */
public interface ScheduledJob {
    String name();

    /** Spring cron expression, or "-" to register the job for manual runs only. */
    String cron();

    JobReport run();
}
