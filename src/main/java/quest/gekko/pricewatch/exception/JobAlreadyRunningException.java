package quest.gekko.pricewatch.exception;

public class JobAlreadyRunningException extends PriceWatchException {
    public JobAlreadyRunningException(String jobName) {
        super("JOB_ALREADY_RUNNING", "Job '" + jobName + "' is already running; trigger skipped.");
    }
}
