package quest.gekko.pricewatch.web.dto;

import quest.gekko.pricewatch.domain.GroupMembership;
import quest.gekko.pricewatch.domain.MemberRole;

import java.time.Instant;

public record MembershipView(Long id, Long groupId, Long trackedProductId, String productId, MemberRole role,
                             int position, Instant addedAt) {

    public static MembershipView of(GroupMembership m) {
        return new MembershipView(m.getId(), m.getGroup().getId(), m.getProduct().getId(),
                m.getProduct().getProductId(), m.getRole(), m.getPosition(), m.getAddedAt());
    }
}
