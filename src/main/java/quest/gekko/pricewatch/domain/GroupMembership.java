package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "group_membership", uniqueConstraints = @UniqueConstraint(columnNames = { "group_id", "tracked_product_id" }))
@Getter @Setter
public class GroupMembership {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id")
    ComparisonGroup group;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tracked_product_id")
    TrackedProduct product;

    @Enumerated(EnumType.STRING) @Column(name = "member_role", nullable = false)
    MemberRole role;

    @Column(name = "sort_position", nullable = false)
    int position;

    @Column(nullable = false)
    Instant addedAt = Instant.now();
}
