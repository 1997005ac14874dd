package quest.gekko.pricewatch.dto;

import java.time.Instant;
import java.util.List;

public record ComparisonHistory(Long groupId, List<ComparisonSnapshotView> snapshots, int totalCount,
                                Instant dateFrom, Instant dateTo) {}
