package quest.gekko.pricewatch.dto;

import java.util.List;

/** Attributes of every member as stored with a comparison snapshot. */
public record ComparisonPayload(MemberView ownProduct, List<MemberView> competitors, List<MemberView> otherItems,
                                boolean fresh, List<String> staleMembers) {}
