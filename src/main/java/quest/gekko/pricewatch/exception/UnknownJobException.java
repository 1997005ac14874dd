package quest.gekko.pricewatch.exception;

public class UnknownJobException extends PriceWatchException {
    public UnknownJobException(String jobName) {
        super("UNKNOWN_JOB", "No job named '" + jobName + "'.");
    }
}
