package quest.gekko.pricewatch.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pricewatch.domain.ComparisonGroup;
import quest.gekko.pricewatch.dto.ComparisonHistory;
import quest.gekko.pricewatch.dto.ComparisonResult;
import quest.gekko.pricewatch.dto.GroupView;
import quest.gekko.pricewatch.dto.UserComparisonStats;
import quest.gekko.pricewatch.service.comparison.ComparisonService;
import quest.gekko.pricewatch.web.dto.AddMemberRequest;
import quest.gekko.pricewatch.web.dto.CreateGroupRequest;
import quest.gekko.pricewatch.web.dto.MembershipView;
import quest.gekko.pricewatch.web.dto.QuickCompareRequest;

import java.util.List;

@RestController
@RequestMapping("/api/comparison")
@RequiredArgsConstructor
public class ComparisonController {
    private final ComparisonService comparisonService;

    @PostMapping("/groups")
    @ResponseStatus(HttpStatus.CREATED)
    public GroupView createGroup(@Valid @RequestBody CreateGroupRequest request) {
        ComparisonGroup group = comparisonService.createGroup(request.ownerId(), request.name(), request.groupType());
        return GroupView.of(group, 0);
    }

    @GetMapping("/groups")
    public List<GroupView> listGroups(@RequestParam String ownerId) {
        return comparisonService.listGroups(ownerId);
    }

    @GetMapping("/groups/{groupId}")
    public GroupView getGroup(@PathVariable Long groupId) {
        return comparisonService.getGroup(groupId);
    }

    @DeleteMapping("/groups/{groupId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteGroup(@PathVariable Long groupId) {
        comparisonService.deleteGroup(groupId);
    }

    @PostMapping("/groups/{groupId}/members")
    @ResponseStatus(HttpStatus.CREATED)
    public MembershipView addMember(@PathVariable Long groupId, @Valid @RequestBody AddMemberRequest request) {
        return MembershipView.of(comparisonService.addMember(groupId, request.productId(), request.role(),
                request.shouldScrapeNow()));
    }

    @GetMapping("/groups/{groupId}/compare")
    public ComparisonResult compare(@PathVariable Long groupId,
                                    @RequestParam(defaultValue = "false") boolean refresh) {
        return comparisonService.computeComparison(groupId, refresh);
    }

    @PostMapping("/quick-compare")
    public ComparisonResult quickCompare(@Valid @RequestBody QuickCompareRequest request) {
        return comparisonService.quickCompare(request.ownerId(), request.ownProductId(),
                request.competitorProductId(), request.groupName(), request.groupId());
    }

    @GetMapping("/groups/{groupId}/history")
    public ComparisonHistory history(@PathVariable Long groupId,
                                     @RequestParam(defaultValue = "30") int days) {
        return comparisonService.getHistory(groupId, days);
    }

    @GetMapping("/users/{ownerId}/stats")
    public UserComparisonStats userStats(@PathVariable String ownerId) {
        return comparisonService.getUserStats(ownerId);
    }
}
