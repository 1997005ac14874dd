package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "comparison_group")
@Getter @Setter
public class ComparisonGroup {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "owner_id", nullable = false)
    String ownerId;

    String name;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    GroupType groupType = GroupType.COMPARISON;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    GroupState state = GroupState.CREATED;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    Instant updatedAt;
}
