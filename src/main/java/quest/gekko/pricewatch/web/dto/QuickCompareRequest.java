package quest.gekko.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code groupId} is optional; when present the pair is added to that group instead of a new one. */
public record QuickCompareRequest(
        @NotBlank @Size(max = 255) String ownerId,
        @NotBlank String ownProductId,
        @NotBlank String competitorProductId,
        @Size(max = 255) String groupName,
        Long groupId) {}
