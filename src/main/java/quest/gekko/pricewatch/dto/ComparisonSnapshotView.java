package quest.gekko.pricewatch.dto;

import com.fasterxml.jackson.databind.JsonNode;
import quest.gekko.pricewatch.domain.Grade;

import java.time.Instant;

public record ComparisonSnapshotView(Long id, Long groupId, Instant createdAt, JsonNode comparisonData,
                                     JsonNode metrics, Double competitivenessIndex, Grade grade) {}
