package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.ComparisonGroup;
import quest.gekko.pricewatch.domain.GroupState;
import quest.gekko.pricewatch.domain.GroupType;

import java.time.Instant;

public record GroupView(Long id, String ownerId, String name, GroupType groupType, GroupState state,
                        long membersCount, Instant createdAt, Instant updatedAt) {

    public static GroupView of(ComparisonGroup g, long membersCount) {
        return new GroupView(g.getId(), g.getOwnerId(), g.getName(), g.getGroupType(), g.getState(),
                membersCount, g.getCreatedAt(), g.getUpdatedAt());
    }
}
