package quest.gekko.pricewatch.exception;

import lombok.Getter;
import quest.gekko.pricewatch.dto.ComparisonResult;

/**
 * The comparison was computed but its snapshot could not be stored. The computed
 * result travels with the exception so callers can still show it.
 */
@Getter
public class SnapshotPersistenceException extends PriceWatchException {
    private final transient ComparisonResult result;

    public SnapshotPersistenceException(ComparisonResult result, Throwable cause) {
        super("PERSISTENCE_ERROR", "Comparison for group " + result.groupId() + " was computed but not saved.", cause);
        this.result = result;
    }
}
