package quest.gekko.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterProductRequest(
        @NotBlank @Size(max = 255) String ownerId,
        @NotBlank String productId,
        Boolean fetchNow) {

    public boolean shouldFetchNow() {
        return fetchNow == null || fetchNow;
    }
}
