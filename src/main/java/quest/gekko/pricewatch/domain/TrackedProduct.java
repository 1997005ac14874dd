package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "tracked_product", uniqueConstraints = @UniqueConstraint(columnNames = { "owner_id", "product_id" }))
@Getter @Setter
public class TrackedProduct {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "owner_id", nullable = false)
    String ownerId;

    @Column(name = "product_id", nullable = false, length = 20)
    String productId;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    ProductStatus status = ProductStatus.ACTIVE;

    @Column(nullable = false)
    boolean problematic;

    // Last known attributes, copied from the newest successful snapshot by the aggregator
    String name;
    Double lastPrice;
    Double lastCardPrice;
    Double lastOldPrice;
    Double lastRating;
    Integer lastReviewCount;
    Boolean lastAvailable;
    String imageUrl;
    String productUrl;
    Instant lastFetchedAt;

    // Rolling window, written by the aggregator only
    Double averagePrice;
    Double minPrice;
    Double maxPrice;
    Integer averageSampleCount;
    Instant averageComputedAt;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    public boolean hasPrice() {
        return lastPrice != null || lastCardPrice != null;
    }
}
