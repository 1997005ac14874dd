package quest.gekko.pricewatch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;

import java.util.List;
import java.util.Optional;

public interface TrackedProductRepository extends JpaRepository<TrackedProduct, Long> {
    Optional<TrackedProduct> findByOwnerIdAndProductId(final String ownerId, final String productId);
    List<TrackedProduct> findByProductId(final String productId);
    List<TrackedProduct> findByOwnerIdOrderByCreatedAtDesc(final String ownerId);
    long countByOwnerId(final String ownerId);

    // Several owners may track the same identifier; the collector fetches it once
    @Query("select distinct p.productId from TrackedProduct p where p.status = :status order by p.productId")
    List<String> findDistinctProductIdsByStatus(@Param("status") final ProductStatus status);
}
