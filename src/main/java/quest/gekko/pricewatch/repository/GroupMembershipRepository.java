package quest.gekko.pricewatch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pricewatch.domain.GroupMembership;

import java.util.List;

public interface GroupMembershipRepository extends JpaRepository<GroupMembership, Long> {

    @Query("""
        select m from GroupMembership m
        join fetch m.product
        where m.group.id = :groupId
        order by m.position asc, m.id asc
        """)
    List<GroupMembership> findWithProductsByGroupId(@Param("groupId") final Long groupId);

    boolean existsByGroup_IdAndProduct_Id(final Long groupId, final Long trackedProductId);

    long countByGroup_Id(final Long groupId);

    @Query("select coalesce(max(m.position), -1) from GroupMembership m where m.group.id = :groupId")
    int findMaxPosition(@Param("groupId") final Long groupId);

    @Modifying
    @Query("delete from GroupMembership m where m.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") final Long groupId);
}
