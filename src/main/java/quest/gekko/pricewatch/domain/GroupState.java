package quest.gekko.pricewatch.domain;

/**
 * Lifecycle of a comparison group. A later compute re-enters COMPUTED/SNAPSHOTTED.
 */
public enum GroupState {
    CREATED, POPULATED, COMPUTED, SNAPSHOTTED
}
