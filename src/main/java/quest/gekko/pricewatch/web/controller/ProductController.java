package quest.gekko.pricewatch.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pricewatch.dto.DiscountMetrics;
import quest.gekko.pricewatch.dto.OwnerReport;
import quest.gekko.pricewatch.dto.PriceSnapshotView;
import quest.gekko.pricewatch.dto.ProductReport;
import quest.gekko.pricewatch.dto.TrackedProductView;
import quest.gekko.pricewatch.dto.WindowAggregate;
import quest.gekko.pricewatch.service.core.PriceHistoryService;
import quest.gekko.pricewatch.service.core.PriceRefreshService;
import quest.gekko.pricewatch.service.core.TrackedProductService;
import quest.gekko.pricewatch.service.report.ReportService;
import quest.gekko.pricewatch.util.ProductIds;
import quest.gekko.pricewatch.web.dto.RegisterProductRequest;
import quest.gekko.pricewatch.web.dto.StatusUpdateRequest;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final TrackedProductService trackedProductService;
    private final PriceHistoryService priceHistoryService;
    private final PriceRefreshService priceRefreshService;
    private final ReportService reportService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TrackedProductView register(@Valid @RequestBody RegisterProductRequest request) {
        return TrackedProductView.of(
                trackedProductService.register(request.ownerId(), request.productId(), request.shouldFetchNow()));
    }

    @GetMapping
    public List<TrackedProductView> list(@RequestParam String ownerId) {
        return trackedProductService.listByOwner(ownerId).stream().map(TrackedProductView::of).toList();
    }

    @GetMapping("/report")
    public OwnerReport ownerReport(@RequestParam String ownerId,
                                   @RequestParam(defaultValue = "30") int days,
                                   @RequestParam(defaultValue = "true") boolean includeProducts) {
        return reportService.ownerReport(ownerId, days, includeProducts);
    }

    @PatchMapping("/{id}/status")
    public TrackedProductView updateStatus(@PathVariable Long id, @Valid @RequestBody StatusUpdateRequest request) {
        return TrackedProductView.of(trackedProductService.updateStatus(id, request.status()));
    }

    // Live fetch that bypasses the cache; the attempt is stored even when it fails
    @PostMapping("/{productId}/refresh")
    public PriceSnapshotView refresh(@PathVariable String productId) {
        return PriceSnapshotView.of(priceRefreshService.refresh(productId));
    }

    @GetMapping("/{productId}/price-history")
    public List<PriceSnapshotView> priceHistory(@PathVariable String productId,
                                                @RequestParam(defaultValue = "30") int days,
                                                @RequestParam(defaultValue = "100") int limit,
                                                @RequestParam(defaultValue = "false") boolean includeFailed) {
        return priceHistoryService.queryRecent(ProductIds.normalize(productId), days, limit, includeFailed).stream()
                .map(PriceSnapshotView::of)
                .toList();
    }

    @GetMapping(value = "/{productId}/price-history/export", produces = "text/csv")
    public ResponseEntity<String> exportPriceHistory(@PathVariable String productId,
                                                     @RequestParam(defaultValue = "30") int days,
                                                     @RequestParam(defaultValue = "false") boolean includeFailed) {
        String csv = reportService.exportPriceHistoryCsv(productId, days, includeFailed);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename("price-history-" + ProductIds.normalize(productId) + ".csv").build().toString())
                .contentType(TEXT_CSV)
                .body(csv);
    }

    @GetMapping("/{productId}/report")
    public ProductReport productReport(@PathVariable String productId,
                                       @RequestParam String ownerId,
                                       @RequestParam(defaultValue = "30") int days,
                                       @RequestParam(defaultValue = "true") boolean includeHistory,
                                       @RequestParam(defaultValue = "100") int limit) {
        return reportService.productReport(ownerId, productId, days, includeHistory, limit);
    }

    @GetMapping("/{productId}/price-average")
    public WindowAggregate priceAverage(@PathVariable String productId,
                                        @RequestParam(defaultValue = "7") int days) {
        return priceHistoryService.queryWindow(ProductIds.normalize(productId), days);
    }

    @GetMapping("/{productId}/discount")
    public DiscountMetrics discount(@PathVariable String productId) {
        return trackedProductService.discount(productId);
    }
}
