package quest.gekko.pricewatch.dto;

import quest.gekko.pricewatch.domain.GroupState;
import quest.gekko.pricewatch.domain.GroupType;

import java.time.Instant;
import java.util.List;

public record ComparisonResult(
        Long groupId,
        String groupName,
        GroupType groupType,
        GroupState state,
        MemberView ownProduct,
        List<MemberView> competitors,
        List<MemberView> otherItems,
        ComparisonMetrics metrics,
        Instant comparedAt,
        boolean fresh,
        List<String> staleMembers,
        Long snapshotId) {}
