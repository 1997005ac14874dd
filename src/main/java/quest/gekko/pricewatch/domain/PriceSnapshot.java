package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One fetch attempt for a product. Rows are insert-only; failed attempts are stored too
 * with {@code success = false} and are left out of every aggregate.
 */
@Entity
@Table(name = "price_snapshot", indexes = @Index(name = "ix_price_snapshot_product_time", columnList = "product_id, captured_at"))
@Getter @Setter
public class PriceSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "product_id", nullable = false, length = 20)
    String productId;

    @Column(name = "captured_at", nullable = false)
    Instant capturedAt;

    @Column(length = 500)
    String name;

    Double price;
    Double cardPrice;
    Double oldPrice;
    Boolean available;
    Double rating;
    Integer reviewCount;

    @Column(nullable = false)
    boolean success;

    @Enumerated(EnumType.STRING)
    FetchErrorType errorType;

    @Column(length = 1000)
    String errorMessage;

    long durationMs;

    String source;

    @Column(length = 1000)
    String imageUrl;

    @Column(length = 1000)
    String productUrl;
}
