package quest.gekko.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import quest.gekko.pricewatch.domain.MemberRole;

public record AddMemberRequest(
        @NotBlank String productId,
        @NotNull MemberRole role,
        Boolean scrapeNow) {

    public boolean shouldScrapeNow() {
        return scrapeNow == null || scrapeNow;
    }
}
