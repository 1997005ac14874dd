package quest.gekko.pricewatch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pricewatch.domain.ComparisonGroup;
import quest.gekko.pricewatch.domain.GroupType;

import java.util.List;

public interface ComparisonGroupRepository extends JpaRepository<ComparisonGroup, Long> {
    List<ComparisonGroup> findByOwnerId(final String ownerId);
    long countByOwnerId(final String ownerId);
    long countByOwnerIdAndGroupType(final String ownerId, final GroupType groupType);
}
