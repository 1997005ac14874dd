package quest.gekko.pricewatch.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.pricewatch.domain.GroupState;
import quest.gekko.pricewatch.domain.GroupType;
import quest.gekko.pricewatch.dto.ComparisonResult;
import quest.gekko.pricewatch.dto.UserComparisonStats;
import quest.gekko.pricewatch.exception.DuplicateMemberException;
import quest.gekko.pricewatch.exception.GroupNotFoundException;
import quest.gekko.pricewatch.exception.InsufficientMembersException;
import quest.gekko.pricewatch.exception.SnapshotPersistenceException;
import quest.gekko.pricewatch.service.comparison.ComparisonService;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ComparisonController.class)
class ComparisonControllerTest {
    static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ComparisonService comparisonService;

    @Test
    void compare_returnsResult() throws Exception {
        when(comparisonService.computeComparison(5L, true)).thenReturn(result(5L, GroupState.SNAPSHOTTED, 12L));

        mockMvc.perform(get("/api/comparison/groups/5/compare").param("refresh", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupId").value(5))
                .andExpect(jsonPath("$.state").value("SNAPSHOTTED"))
                .andExpect(jsonPath("$.snapshotId").value(12))
                .andExpect(jsonPath("$.fresh").value(true));
    }

    @Test
    void compare_unknownGroup_is404() throws Exception {
        when(comparisonService.computeComparison(9L, false)).thenThrow(new GroupNotFoundException(9L));

        mockMvc.perform(get("/api/comparison/groups/9/compare"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GROUP_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/comparison/groups/9/compare"));
    }

    @Test
    void compare_singleMember_is422() throws Exception {
        when(comparisonService.computeComparison(5L, false)).thenThrow(new InsufficientMembersException(5L, 1));

        mockMvc.perform(get("/api/comparison/groups/5/compare"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_MEMBERS"));
    }

    @Test
    void compare_snapshotNotSaved_is503WithComputedResult() throws Exception {
        when(comparisonService.computeComparison(5L, false)).thenThrow(new SnapshotPersistenceException(
                result(5L, GroupState.COMPUTED, null), new DataAccessResourceFailureException("db down")));

        mockMvc.perform(get("/api/comparison/groups/5/compare"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("PERSISTENCE_ERROR"))
                .andExpect(jsonPath("$.payload.groupId").value(5))
                .andExpect(jsonPath("$.payload.state").value("COMPUTED"));
    }

    @Test
    void addMember_duplicate_is409() throws Exception {
        when(comparisonService.addMember(eq(5L), eq("123456789"), any(), anyBoolean()))
                .thenThrow(new DuplicateMemberException(5L, "123456789"));

        mockMvc.perform(post("/api/comparison/groups/5/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"123456789\",\"role\":\"COMPETITOR\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_MEMBER"));
    }

    @Test
    void addMember_missingRole_is400WithFieldErrors() throws Exception {
        mockMvc.perform(post("/api/comparison/groups/5/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"123456789\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fieldErrors", hasSize(1)))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("role"));

        verifyNoInteractions(comparisonService);
    }

    @Test
    void quickCompare_passesRequestThrough() throws Exception {
        when(comparisonService.quickCompare("alice", "111111111", "222222222", null, null))
                .thenReturn(result(3L, GroupState.SNAPSHOTTED, 1L));

        mockMvc.perform(post("/api/comparison/quick-compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ownerId":"alice","ownProductId":"111111111","competitorProductId":"222222222"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupId").value(3));
    }

    @Test
    void deleteGroup_is204() throws Exception {
        mockMvc.perform(delete("/api/comparison/groups/5"))
                .andExpect(status().isNoContent());

        verify(comparisonService).deleteGroup(5L);
    }

    @Test
    void userStats_noSnapshots_hasNullAverage() throws Exception {
        when(comparisonService.getUserStats("alice"))
                .thenReturn(new UserComparisonStats("alice", 0, 0, 0, null, null));

        mockMvc.perform(get("/api/comparison/users/alice/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalGroups").value(0))
                .andExpect(jsonPath("$.avgCompetitivenessIndex").doesNotExist());
    }

    @Test
    void history_nonNumericDays_is400() throws Exception {
        mockMvc.perform(get("/api/comparison/groups/5/history").param("days", "week"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Type Mismatch"));
    }

    private static ComparisonResult result(Long groupId, GroupState state, Long snapshotId) {
        return new ComparisonResult(groupId, "g", GroupType.COMPARISON, state, null, List.of(), List.of(), null,
                NOW, true, List.of(), snapshotId);
    }
}
