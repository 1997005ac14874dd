package quest.gekko.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import quest.gekko.pricewatch.domain.GroupType;

public record CreateGroupRequest(
        @NotBlank @Size(max = 255) String ownerId,
        @Size(max = 255) String name,
        GroupType groupType) {}
