package quest.gekko.pricewatch.domain;

public enum RunStatus {
    COMPLETED, DEGRADED, FAILED, SKIPPED
}
