package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Immutable record of one computed comparison. Payloads are JSON documents.
 */
@Entity
@Table(name = "comparison_snapshot", indexes = @Index(name = "ix_comparison_snapshot_group_time", columnList = "group_id, created_at"))
@Getter @Setter
public class ComparisonSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id")
    ComparisonGroup group;

    @Column(name = "created_at", nullable = false)
    Instant createdAt;

    @Column(nullable = false, length = 65535)
    String comparisonData;

    @Column(nullable = false, length = 65535)
    String metrics;

    Double competitivenessIndex;

    @Enumerated(EnumType.STRING)
    Grade grade;
}
