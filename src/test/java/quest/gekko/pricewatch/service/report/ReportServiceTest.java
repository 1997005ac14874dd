package quest.gekko.pricewatch.service.report;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import quest.gekko.pricewatch.domain.PriceSnapshot;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.OwnerReport;
import quest.gekko.pricewatch.dto.PriceSnapshotView;
import quest.gekko.pricewatch.dto.ProductReport;
import quest.gekko.pricewatch.exception.FetchTimeoutException;
import quest.gekko.pricewatch.exception.ProductNotFoundException;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.service.core.PriceHistoryService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import({ ReportService.class, PriceHistoryService.class })
class ReportServiceTest {
    static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");
    static final String ID = "123456789";
    static final String OTHER = "987654321";

    @TestConfiguration
    static class Config {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private ReportService reports;
    @Autowired
    private PriceHistoryService history;
    @Autowired
    private TrackedProductRepository products;

    @Test
    void productReport_countsAttemptsAndSummarizesWindows() {
        track("alice", ID, ProductStatus.ACTIVE, false);
        history.append(sample(ID, 1000.0, NOW.minus(Duration.ofDays(1))));
        history.append(sample(ID, 2000.0, NOW.minus(Duration.ofDays(3))));
        history.append(sample(ID, 4000.0, NOW.minus(Duration.ofDays(20))));
        history.append(sample(ID, 9000.0, NOW.minus(Duration.ofDays(40))));
        history.append(PriceHistoryService.failure(ID, new FetchTimeoutException(ID, null), NOW.minusSeconds(3600), 20_000));

        ProductReport report = reports.productReport("alice", ID, 30, true, 100);

        assertThat(report.totalAttempts()).isEqualTo(4);
        assertThat(report.successfulAttempts()).isEqualTo(3);
        assertThat(report.window().sampleCount()).isEqualTo(3);
        assertThat(report.window().average()).isCloseTo(2333.33, within(0.01));
        assertThat(report.window().max()).isEqualTo(4000.0);
        assertThat(report.lastSevenDays().average()).isEqualTo(1500.0);
        assertThat(report.history()).extracting(PriceSnapshotView::success).containsExactly(false, true, true, true);
        assertThat(report.product().ownerId()).isEqualTo("alice");
        assertThat(report.generatedAt()).isEqualTo(NOW);
    }

    @Test
    void productReport_withoutHistory_leavesItOut() {
        track("alice", ID, ProductStatus.ACTIVE, false);

        ProductReport report = reports.productReport("alice", ID, 30, false, 100);

        assertThat(report.history()).isNull();
        assertThat(report.totalAttempts()).isZero();
        assertThat(report.window().isEmpty()).isTrue();
    }

    @Test
    void productReport_productOfAnotherOwner_isNotFound() {
        track("bob", ID, ProductStatus.ACTIVE, false);

        assertThatThrownBy(() -> reports.productReport("alice", ID, 30, true, 100))
                .isInstanceOf(ProductNotFoundException.class);
    }

    @Test
    void ownerReport_countsProductsAndTheirAttempts() {
        track("alice", ID, ProductStatus.ACTIVE, false);
        track("alice", OTHER, ProductStatus.INACTIVE, true);
        track("bob", ID, ProductStatus.ACTIVE, false);
        history.append(sample(ID, 1000.0, NOW.minus(Duration.ofDays(1))));
        history.append(sample(ID, 1100.0, NOW.minus(Duration.ofDays(2))));
        history.append(PriceHistoryService.failure(OTHER, new FetchTimeoutException(OTHER, null), NOW.minusSeconds(60), 20_000));

        OwnerReport report = reports.ownerReport("alice", 30, true);

        assertThat(report.totalProducts()).isEqualTo(2);
        assertThat(report.activeProducts()).isEqualTo(1);
        assertThat(report.problematicProducts()).isEqualTo(1);
        assertThat(report.totalAttempts()).isEqualTo(3);
        assertThat(report.successfulAttempts()).isEqualTo(2);
        assertThat(report.products()).hasSize(2);
    }

    @Test
    void ownerReport_noProducts_isAllZeros() {
        OwnerReport report = reports.ownerReport("nobody", 30, false);

        assertThat(report.totalProducts()).isZero();
        assertThat(report.totalAttempts()).isZero();
        assertThat(report.products()).isNull();
    }

    @Test
    void exportPriceHistoryCsv_writesHeaderThenRowsNewestFirst() {
        history.append(sample(ID, 1000.0, NOW.minus(Duration.ofDays(2))));
        history.append(sample(ID, 1100.0, NOW.minus(Duration.ofDays(1))));
        history.append(PriceHistoryService.failure(ID, new FetchTimeoutException(ID, null), NOW.minusSeconds(60), 20_000));

        String[] lines = reports.exportPriceHistoryCsv(ID, 30, false).split("\n");

        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo(
                "productId,capturedAt,price,cardPrice,oldPrice,available,rating,reviewCount,success,errorType");
        assertThat(lines[1]).startsWith("123456789,2024-05-19T12:00:00Z,1100.0,");
        assertThat(lines[2]).startsWith("123456789,2024-05-18T12:00:00Z,1000.0,");
    }

    @Test
    void exportPriceHistoryCsv_noRows_isHeaderOnly() {
        assertThat(reports.exportPriceHistoryCsv(ID, 30, true))
                .isEqualTo("productId,capturedAt,price,cardPrice,oldPrice,available,rating,reviewCount,success,errorType\n");
    }

    private void track(String ownerId, String productId, ProductStatus status, boolean problematic) {
        TrackedProduct p = new TrackedProduct();
        p.setOwnerId(ownerId);
        p.setProductId(productId);
        p.setStatus(status);
        p.setProblematic(problematic);
        p.setCreatedAt(NOW);
        products.save(p);
    }

    private static PriceSnapshot sample(String productId, double price, Instant at) {
        PriceSnapshot s = new PriceSnapshot();
        s.setProductId(productId);
        s.setPrice(price);
        s.setCapturedAt(at);
        s.setSuccess(true);
        s.setSource("json-ld");
        return s;
    }
}
