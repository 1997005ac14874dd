package quest.gekko.pricewatch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pricewatch.domain.CollectorRun;

import java.time.Instant;
import java.util.List;

public interface CollectorRunRepository extends JpaRepository<CollectorRun, Long> {
    List<CollectorRun> findTop20ByOrderByStartedAtDesc();

    @Modifying
    @Query("delete from CollectorRun r where r.startedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") final Instant cutoff);
}
