package quest.gekko.pricewatch.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.pricewatch.domain.RunStatus;
import quest.gekko.pricewatch.dto.FetchStats;
import quest.gekko.pricewatch.exception.UnknownJobException;
import quest.gekko.pricewatch.repository.CollectorRunRepository;
import quest.gekko.pricewatch.service.core.PriceAggregator;
import quest.gekko.pricewatch.service.fetch.FetchClient;
import quest.gekko.pricewatch.service.scheduling.JobReport;
import quest.gekko.pricewatch.service.scheduling.JobRunner;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobRunner jobRunner;
    @MockBean
    private PriceAggregator aggregator;
    @MockBean
    private CollectorRunRepository collectorRuns;
    @MockBean
    private FetchClient fetchClient;

    @Test
    void runJob_returnsReport() throws Exception {
        Instant start = Instant.parse("2024-05-20T03:00:00Z");
        when(jobRunner.trigger("price-history-collector")).thenReturn(Optional.of(JobReport.of(
                "price-history-collector", start, start.plusSeconds(42), RunStatus.COMPLETED,
                Map.of("attempted", 10L, "succeeded", 7L, "failed", 3L))));

        mockMvc.perform(post("/admin/jobs/price-history-collector/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.durationMs").value(42000))
                .andExpect(jsonPath("$.counters.succeeded").value(7));
    }

    @Test
    void runJob_alreadyRunning_is409() throws Exception {
        when(jobRunner.trigger("price-history-collector")).thenReturn(Optional.empty());

        mockMvc.perform(post("/admin/jobs/price-history-collector/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("JOB_ALREADY_RUNNING"));
    }

    @Test
    void runJob_unknown_is404() throws Exception {
        when(jobRunner.trigger("nope")).thenThrow(new UnknownJobException("nope"));

        mockMvc.perform(post("/admin/jobs/nope/run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_JOB"));
    }

    @Test
    void fetchStats_exposesCounters() throws Exception {
        when(fetchClient.stats()).thenReturn(new FetchStats(10, 4, 6, 5, 1, 2, 4));

        mockMvc.perform(get("/admin/fetch-stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHits").value(4))
                .andExpect(jsonPath("$.retries").value(2));
    }

    @Test
    void refreshAverages_returnsCount() throws Exception {
        when(aggregator.refreshAll()).thenReturn(3);

        mockMvc.perform(post("/admin/averages/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshed").value(3));
    }
}
