package quest.gekko.pricewatch.service.comparison;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.domain.ComparisonGroup;
import quest.gekko.pricewatch.domain.ComparisonSnapshot;
import quest.gekko.pricewatch.domain.GroupMembership;
import quest.gekko.pricewatch.domain.GroupState;
import quest.gekko.pricewatch.domain.GroupType;
import quest.gekko.pricewatch.domain.MemberRole;
import quest.gekko.pricewatch.domain.TrackedProduct;
import quest.gekko.pricewatch.dto.ComparisonHistory;
import quest.gekko.pricewatch.dto.ComparisonMetrics;
import quest.gekko.pricewatch.dto.ComparisonPayload;
import quest.gekko.pricewatch.dto.ComparisonResult;
import quest.gekko.pricewatch.dto.ComparisonSnapshotView;
import quest.gekko.pricewatch.dto.GroupView;
import quest.gekko.pricewatch.dto.MemberView;
import quest.gekko.pricewatch.dto.UserComparisonStats;
import quest.gekko.pricewatch.exception.DuplicateMemberException;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.GroupNotFoundException;
import quest.gekko.pricewatch.exception.InsufficientMembersException;
import quest.gekko.pricewatch.exception.PriceWatchException;
import quest.gekko.pricewatch.exception.SnapshotPersistenceException;
import quest.gekko.pricewatch.repository.ComparisonGroupRepository;
import quest.gekko.pricewatch.repository.ComparisonSnapshotRepository;
import quest.gekko.pricewatch.repository.GroupMembershipRepository;
import quest.gekko.pricewatch.repository.TrackedProductRepository;
import quest.gekko.pricewatch.service.core.DiscountCalculator;
import quest.gekko.pricewatch.service.core.PriceRefreshService;
import quest.gekko.pricewatch.service.core.TrackedProductService;
import quest.gekko.pricewatch.util.Numbers;
import quest.gekko.pricewatch.util.ProductIds;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Comparison groups and their life cycle:
 * CREATED, POPULATED (two or more members), COMPUTED (metrics attached), SNAPSHOTTED (persisted).
 * Computing again moves the group back through COMPUTED and SNAPSHOTTED without touching membership.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComparisonService {
    private final ComparisonGroupRepository groups;
    private final GroupMembershipRepository memberships;
    private final ComparisonSnapshotRepository snapshots;
    private final TrackedProductRepository products;
    private final TrackedProductService trackedProducts;
    private final PriceRefreshService refresher;
    private final ComparisonMetricsCalculator calculator;
    private final DiscountCalculator discountCalculator;
    private final ObjectMapper objectMapper;
    private final PriceWatchProperties.Comparison props;
    private final Clock clock;

    public ComparisonGroup createGroup(String ownerId, String name, GroupType type) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        ComparisonGroup group = new ComparisonGroup();
        group.setOwnerId(ownerId);
        group.setName(name);
        group.setGroupType(type != null ? type : GroupType.COMPARISON);
        group.setState(GroupState.CREATED);
        group.setCreatedAt(clock.instant());
        group.setUpdatedAt(group.getCreatedAt());
        group = groups.save(group);
        log.info("Created {} group {} for owner {}", group.getGroupType(), group.getId(), ownerId);
        return group;
    }

    @Transactional(readOnly = true)
    public GroupView getGroup(Long groupId) {
        return GroupView.of(requireGroup(groupId), memberships.countByGroup_Id(groupId));
    }

    @Transactional(readOnly = true)
    public List<GroupView> listGroups(String ownerId) {
        return groups.findByOwnerId(ownerId).stream()
                .map(g -> GroupView.of(g, memberships.countByGroup_Id(g.getId())))
                .toList();
    }

    /** Removes the group with its memberships and snapshots. Products and price history stay. */
    @Transactional
    public void deleteGroup(Long groupId) {
        ComparisonGroup group = requireGroup(groupId);
        int removedSnapshots = snapshots.deleteByGroupId(groupId);
        int removedMembers = memberships.deleteByGroupId(groupId);
        groups.delete(group);
        log.info("Deleted group {} ({} members, {} snapshots)", groupId, removedMembers, removedSnapshots);
    }

    /**
     * @throws DuplicateMemberException if the product is already in the group
     * @throws quest.gekko.pricewatch.exception.ProductNotFoundException if a live fetch was needed and failed
     */
    public GroupMembership addMember(Long groupId, String rawProductId, MemberRole role, boolean scrapeNow) {
        ComparisonGroup group = requireGroup(groupId);
        String productId = ProductIds.normalize(rawProductId);
        if (isMember(group, productId)) throw new DuplicateMemberException(groupId, productId);

        TrackedProduct product = trackedProducts.resolve(group.getOwnerId(), productId, scrapeNow);
        return insertMembership(group, product, role != null ? role : MemberRole.ITEM);
    }

    /**
     * Creates a group holding both products and computes it straight away. With an existing
     * group id the missing members are added to that group instead.
     */
    public ComparisonResult quickCompare(String ownerId, String ownProductId, String competitorProductId,
                                         String groupName, Long existingGroupId) {
        String ownId = ProductIds.normalize(ownProductId);
        String competitorId = ProductIds.normalize(competitorProductId);
        if (ownId.equals(competitorId)) {
            throw new IllegalArgumentException("Own and competitor products must differ");
        }

        ComparisonGroup group = existingGroupId != null ? requireGroup(existingGroupId) : null;
        String owner = group != null ? group.getOwnerId() : ownerId;

        // Already priced products are not fetched by resolve; they are read live when the group is computed
        Set<String> refetch = new HashSet<>();
        if (isPriced(owner, ownId)) refetch.add(ownId);
        if (isPriced(owner, competitorId)) refetch.add(competitorId);

        // Both products are resolved before the group is written so a failed fetch leaves nothing behind
        TrackedProduct own = trackedProducts.resolve(owner, ownId, true);
        TrackedProduct competitor = trackedProducts.resolve(owner, competitorId, true);

        if (group == null) {
            String name = groupName != null && !groupName.isBlank() ? groupName : ownId + " vs " + competitorId;
            group = createGroup(owner, name, GroupType.COMPARISON);
        }
        if (!isMember(group, ownId)) insertMembership(group, own, MemberRole.OWN);
        if (!isMember(group, competitorId)) insertMembership(group, competitor, MemberRole.COMPETITOR);

        return compute(group.getId(), p -> refetch.contains(p.getProductId()) || isOutdated(p));
    }

    /**
     * Loads every member, refetching those that are outdated or all of them when
     * {@code refresh} is set, and computes metrics for exactly one own and one competitor
     * member. Members whose refetch failed keep their last known attributes and are listed
     * as stale.
     *
     * @throws InsufficientMembersException with fewer than two members; nothing is stored
     * @throws SnapshotPersistenceException if the snapshot could not be stored; it carries the result
     */
    public ComparisonResult computeComparison(Long groupId, boolean refresh) {
        return compute(groupId, refresh ? p -> true : this::isOutdated);
    }

    /**
     * Computes from the stored attributes only, without any live fetch. Used by the daily
     * snapshot job, which runs after the collector has refreshed everything.
     */
    public ComparisonResult computeFromStored(Long groupId) {
        return compute(groupId, p -> false);
    }

    private ComparisonResult compute(Long groupId, Predicate<TrackedProduct> needsLiveRead) {
        ComparisonGroup group = requireGroup(groupId);
        List<GroupMembership> members = memberships.findWithProductsByGroupId(groupId);
        if (members.size() < 2) throw new InsufficientMembersException(groupId, members.size());

        Set<String> stale = new LinkedHashSet<>();
        boolean refetched = false;
        for (GroupMembership member : members) {
            TrackedProduct product = member.getProduct();
            if (!needsLiveRead.test(product)) continue;
            refetched = true;
            try {
                refresher.refresh(product.getProductId());
            } catch (FetchException e) {
                log.warn("Using last known attributes of {} in group {}: {}", product.getProductId(), groupId, e.getMessage());
                stale.add(product.getProductId());
            }
        }
        if (refetched) members = memberships.findWithProductsByGroupId(groupId);

        MemberView own = null;
        int ownCount = 0;
        List<MemberView> competitors = new ArrayList<>();
        List<MemberView> items = new ArrayList<>();
        for (GroupMembership member : members) {
            MemberView view = toView(member);
            switch (member.getRole()) {
                case OWN -> {
                    if (own == null) own = view;
                    else items.add(view);
                    ownCount++;
                }
                case COMPETITOR -> competitors.add(view);
                default -> items.add(view);
            }
        }

        ComparisonMetrics metrics = ownCount == 1 && competitors.size() == 1
                ? calculator.compute(own, competitors.get(0))
                : null;
        Instant now = clock.instant();
        boolean fresh = stale.isEmpty();
        List<String> staleMembers = List.copyOf(stale);

        if (metrics == null) {
            log.info("Group {} has {} own and {} competitor members; showing members without metrics",
                    groupId, ownCount, competitors.size());
            return new ComparisonResult(groupId, group.getName(), group.getGroupType(), group.getState(), own,
                    competitors, items, null, now, fresh, staleMembers, null);
        }

        ComparisonResult computed = new ComparisonResult(groupId, group.getName(), group.getGroupType(),
                GroupState.COMPUTED, own, competitors, items, metrics, now, fresh, staleMembers, null);
        ComparisonSnapshot snapshot = new ComparisonSnapshot();
        try {
            snapshot.setGroup(group);
            snapshot.setCreatedAt(now);
            snapshot.setComparisonData(objectMapper.writeValueAsString(
                    new ComparisonPayload(own, competitors, items, fresh, staleMembers)));
            snapshot.setMetrics(objectMapper.writeValueAsString(metrics));
            snapshot.setCompetitivenessIndex(metrics.competitivenessIndex());
            snapshot.setGrade(metrics.grade());
            snapshot = snapshots.save(snapshot);
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Could not store comparison snapshot for group {}", groupId, e);
            throw new SnapshotPersistenceException(computed, e);
        }

        group.setState(GroupState.SNAPSHOTTED);
        group.setUpdatedAt(now);
        groups.save(group);

        log.info("Group {} compared: index {} grade {}{}", groupId, metrics.competitivenessIndex(), metrics.grade(),
                fresh ? "" : " (stale: " + staleMembers + ")");
        return new ComparisonResult(groupId, group.getName(), group.getGroupType(), GroupState.SNAPSHOTTED, own,
                competitors, items, metrics, now, fresh, staleMembers, snapshot.getId());
    }

    /** Snapshots of the last {@code days} days, oldest first. */
    @Transactional(readOnly = true)
    public ComparisonHistory getHistory(Long groupId, int days) {
        if (days < 1) throw new IllegalArgumentException("days must be at least 1, got " + days);
        requireGroup(groupId);
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<ComparisonSnapshotView> views = snapshots
                .findByGroup_IdAndCreatedAtGreaterThanEqualOrderByCreatedAtAscIdAsc(groupId, since).stream()
                .map(s -> new ComparisonSnapshotView(s.getId(), groupId, s.getCreatedAt(),
                        readJson(s.getComparisonData()), readJson(s.getMetrics()),
                        s.getCompetitivenessIndex(), s.getGrade()))
                .toList();
        return new ComparisonHistory(groupId, views, views.size(),
                views.isEmpty() ? null : views.get(0).createdAt(),
                views.isEmpty() ? null : views.get(views.size() - 1).createdAt());
    }

    /** Averages the index over the newest snapshot of each of the owner's groups. */
    @Transactional(readOnly = true)
    public UserComparisonStats getUserStats(String ownerId) {
        Map<Long, ComparisonSnapshot> latestPerGroup = new LinkedHashMap<>();
        for (ComparisonSnapshot s : snapshots.findLatestPerGroupByOwner(ownerId)) {
            // Two snapshots of a group can share the newest timestamp; keep the later insert
            latestPerGroup.merge(s.getGroup().getId(), s, (a, b) -> a.getId() >= b.getId() ? a : b);
        }
        OptionalDouble average = latestPerGroup.values().stream()
                .filter(s -> s.getCompetitivenessIndex() != null)
                .mapToDouble(ComparisonSnapshot::getCompetitivenessIndex)
                .average();
        Instant last = latestPerGroup.values().stream()
                .map(ComparisonSnapshot::getCreatedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return new UserComparisonStats(ownerId,
                groups.countByOwnerId(ownerId),
                groups.countByOwnerIdAndGroupType(ownerId, GroupType.COMPARISON),
                products.countByOwnerId(ownerId),
                average.isPresent() ? Numbers.round(average.getAsDouble(), 4) : null,
                last);
    }

    private GroupMembership insertMembership(ComparisonGroup group, TrackedProduct product, MemberRole role) {
        GroupMembership membership = new GroupMembership();
        membership.setGroup(group);
        membership.setProduct(product);
        membership.setRole(role);
        membership.setPosition(memberships.findMaxPosition(group.getId()) + 1);
        membership.setAddedAt(clock.instant());
        try {
            membership = memberships.saveAndFlush(membership);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateMemberException(group.getId(), product.getProductId());
        }

        if (group.getState() == GroupState.CREATED && memberships.countByGroup_Id(group.getId()) >= 2) {
            group.setState(GroupState.POPULATED);
        }
        group.setUpdatedAt(clock.instant());
        groups.save(group);
        log.info("Added {} as {} to group {}", product.getProductId(), role, group.getId());
        return membership;
    }

    private boolean isMember(ComparisonGroup group, String productId) {
        return products.findByOwnerIdAndProductId(group.getOwnerId(), productId)
                .map(p -> memberships.existsByGroup_IdAndProduct_Id(group.getId(), p.getId()))
                .orElse(false);
    }

    private boolean isPriced(String ownerId, String productId) {
        return products.findByOwnerIdAndProductId(ownerId, productId).map(TrackedProduct::hasPrice).orElse(false);
    }

    private boolean isOutdated(TrackedProduct product) {
        Instant fetchedAt = product.getLastFetchedAt();
        return fetchedAt == null || fetchedAt.isBefore(clock.instant().minus(props.freshness()));
    }

    private MemberView toView(GroupMembership member) {
        TrackedProduct p = member.getProduct();
        Double effective = p.getLastCardPrice() != null ? p.getLastCardPrice() : p.getLastPrice();
        return new MemberView(p.getId(), p.getProductId(), member.getRole(), member.getPosition(), p.getName(),
                p.getLastPrice(), p.getLastCardPrice(), p.getLastOldPrice(), p.getAveragePrice(),
                discountCalculator.discountIndex(p.getAveragePrice(), effective),
                p.getLastRating(), p.getLastReviewCount(), p.getLastAvailable(), p.getImageUrl(),
                p.getProductUrl(), p.getLastFetchedAt());
    }

    private ComparisonGroup requireGroup(Long groupId) {
        return groups.findById(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PriceWatchException("CORRUPT_SNAPSHOT", "Stored comparison payload is not valid JSON", e);
        }
    }
}
