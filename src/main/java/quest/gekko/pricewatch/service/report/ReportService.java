package quest.gekko.pricewatch.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.domain.ProductStatus;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.OwnerReport;
import quest.gekko.pricewatch.dto.PriceSnapshotView;
import quest.gekko.pricewatch.dto.ProductReport;
import quest.gekko.pricewatch.dto.TrackedProductView;
import quest.gekko.pricewatch.exception.PriceWatchException;
import quest.gekko.pricewatch.exception.ProductNotFoundException;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.service.core.PriceHistoryService;
import quest.gekko.pricewatch.util.ProductIds;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Read-only reports over the tracked products and their price history, as JSON views or CSV.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {
    static final int AVERAGE_DAYS = 7;
    static final int MAX_EXPORT_ROWS = 10_000;

    private static final CsvMapper CSV = CsvMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final CsvSchema PRICE_HISTORY_SCHEMA = CSV.schemaFor(PriceHistoryCsvRow.class).withHeader();

    private final TrackedProductRepository products;
    private final PriceHistoryService history;
    private final Clock clock;

    /**
     * @throws ProductNotFoundException if the owner does not track the product
     */
    @Transactional(readOnly = true)
    public ProductReport productReport(String ownerId, String rawProductId, int days, boolean includeHistory,
                                       int historyLimit) {
        String productId = ProductIds.normalize(rawProductId);
        TrackedProduct product = products.findByOwnerIdAndProductId(ownerId, productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        List<PriceSnapshotView> rows = includeHistory
                ? history.queryRecent(productId, days, historyLimit, true).stream().map(PriceSnapshotView::of).toList()
                : null;
        ProductReport report = new ProductReport(ownerId, productId, TrackedProductView.of(product), days,
                history.countAttempts(productId, days, false),
                history.countAttempts(productId, days, true),
                history.queryWindow(productId, days),
                history.queryWindow(productId, AVERAGE_DAYS),
                rows,
                clock.instant());
        log.info("Product report for {} (owner {}): {} attempts in {} days", productId, ownerId,
                report.totalAttempts(), days);
        return report;
    }

    /** An owner with no products gets a report of zeros. */
    @Transactional(readOnly = true)
    public OwnerReport ownerReport(String ownerId, int days, boolean includeProducts) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        List<TrackedProduct> owned = products.findByOwnerIdOrderByCreatedAtDesc(ownerId);

        long total = 0;
        long successful = 0;
        for (String productId : owned.stream().map(TrackedProduct::getProductId).collect(Collectors.toSet())) {
            total += history.countAttempts(productId, days, false);
            successful += history.countAttempts(productId, days, true);
        }

        OwnerReport report = new OwnerReport(ownerId, days, owned.size(),
                (int) owned.stream().filter(p -> p.getStatus() == ProductStatus.ACTIVE).count(),
                (int) owned.stream().filter(TrackedProduct::isProblematic).count(),
                total, successful,
                includeProducts ? owned.stream().map(TrackedProductView::of).toList() : null,
                clock.instant());
        log.info("Owner report for {}: {} products, {} attempts in {} days", ownerId, owned.size(), total, days);
        return report;
    }

    /** Price history as CSV with a header row, newest first. No rows gives just the header. */
    @Transactional(readOnly = true)
    public String exportPriceHistoryCsv(String rawProductId, int days, boolean includeFailed) {
        String productId = ProductIds.normalize(rawProductId);
        List<PriceHistoryCsvRow> rows = history.queryRecent(productId, days, MAX_EXPORT_ROWS, includeFailed).stream()
                .map(PriceHistoryCsvRow::of)
                .toList();
        if (rows.isEmpty()) return header(PRICE_HISTORY_SCHEMA);
        try {
            String csv = CSV.writer(PRICE_HISTORY_SCHEMA).writeValueAsString(rows);
            log.info("Exported {} price history rows of {}", rows.size(), productId);
            return csv;
        } catch (JsonProcessingException e) {
            throw new PriceWatchException("EXPORT_FAILED", "Could not export the price history of " + productId, e);
        }
    }

    private static String header(CsvSchema schema) {
        return StreamSupport.stream(schema.spliterator(), false)
                .map(CsvSchema.Column::getName)
                .collect(Collectors.joining(",", "", "\n"));
    }
}
