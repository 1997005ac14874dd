package quest.gekko.pricewatch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pricewatch.domain.ComparisonSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ComparisonSnapshotRepository extends JpaRepository<ComparisonSnapshot, Long> {

    List<ComparisonSnapshot> findByGroup_IdAndCreatedAtGreaterThanEqualOrderByCreatedAtAscIdAsc(
            final Long groupId, final Instant since);

    Optional<ComparisonSnapshot> findFirstByGroup_IdOrderByCreatedAtDesc(final Long groupId);

    // Newest snapshot of every group the owner has
    @Query("""
        select s from ComparisonSnapshot s
        where s.group.ownerId = :ownerId
          and s.createdAt = (select max(s2.createdAt) from ComparisonSnapshot s2 where s2.group = s.group)
        """)
    List<ComparisonSnapshot> findLatestPerGroupByOwner(@Param("ownerId") final String ownerId);

    @Modifying
    @Query("delete from ComparisonSnapshot s where s.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") final Long groupId);

    @Modifying
    @Query("delete from ComparisonSnapshot s where s.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") final Instant cutoff);
}
