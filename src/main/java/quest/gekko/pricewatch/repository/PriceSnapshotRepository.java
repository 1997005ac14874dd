package quest.gekko.pricewatch.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.dto.WindowAggregate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PriceSnapshotRepository extends JpaRepository<PriceSnapshot, Long> {

    @Query("""
        select new quest.gekko.pricewatch.dto.WindowAggregate(
               avg(s.price), min(s.price), max(s.price), count(s), min(s.capturedAt), max(s.capturedAt))
        from PriceSnapshot s
        where s.productId = :productId
          and s.success = true
          and s.price is not null
          and s.capturedAt >= :since
        """)
    WindowAggregate aggregateSince(@Param("productId") final String productId, @Param("since") final Instant since);

    Optional<PriceSnapshot> findFirstByProductIdAndSuccessTrueOrderByCapturedAtDesc(final String productId);

    List<PriceSnapshot> findByProductIdOrderByCapturedAtDesc(final String productId, final Pageable pageable);

    List<PriceSnapshot> findByProductIdAndCapturedAtGreaterThanEqualOrderByCapturedAtDesc(
            final String productId, final Instant since, final Pageable pageable);

    List<PriceSnapshot> findByProductIdAndSuccessTrueAndCapturedAtGreaterThanEqualOrderByCapturedAtDesc(
            final String productId, final Instant since, final Pageable pageable);

    long countByProductIdAndCapturedAtGreaterThanEqual(final String productId, final Instant since);

    long countByProductIdAndSuccessTrueAndCapturedAtGreaterThanEqual(final String productId, final Instant since);

    @Modifying
    @Query("delete from PriceSnapshot s where s.capturedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") final Instant cutoff);
}
