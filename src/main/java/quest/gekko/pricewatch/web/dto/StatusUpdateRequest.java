package quest.gekko.pricewatch.web.dto;

import jakarta.validation.constraints.NotNull;
import quest.gekko.pricewatch.domain.ProductStatus;

public record StatusUpdateRequest(@NotNull ProductStatus status) {}
