package quest.gekko.pricewatch.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pricewatch.dto.FetchStats;
import quest.gekko.pricewatch.exception.JobAlreadyRunningException;
import quest.gekko.pricewatch.repository.CollectorRunRepository;
import quest.gekko.pricewatch.service.core.PriceAggregator;
import quest.gekko.pricewatch.service.fetch.FetchClient;
import quest.gekko.pricewatch.service.scheduling.JobReport;
import quest.gekko.pricewatch.service.scheduling.JobRunner;
import quest.gekko.pricewatch.web.dto.CollectorRunView;
import quest.gekko.pricewatch.web.dto.JobView;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final JobRunner jobRunner;
    private final PriceAggregator aggregator;
    private final CollectorRunRepository collectorRuns;
    private final FetchClient fetchClient;

    @GetMapping("/jobs")
    public List<JobView> jobs() {
        return jobRunner.jobs().stream()
                .map(job -> new JobView(job.name(), job.cron(), jobRunner.isRunning(job.name())))
                .toList();
    }

    // Runs on the request thread and answers with the run summary
    @PostMapping("/jobs/{jobName}/run")
    public JobReport runJob(@PathVariable String jobName) {
        log.info("Manual trigger of job {}", jobName);
        return jobRunner.trigger(jobName).orElseThrow(() -> new JobAlreadyRunningException(jobName));
    }

    @PostMapping("/averages/refresh")
    public Map<String, Integer> refreshAverages() {
        return Map.of("refreshed", aggregator.refreshAll());
    }

    @GetMapping("/runs")
    public List<CollectorRunView> runs() {
        return collectorRuns.findTop20ByOrderByStartedAtDesc().stream().map(CollectorRunView::of).toList();
    }

    @GetMapping("/fetch-stats")
    public FetchStats fetchStats() {
        return fetchClient.stats();
    }
}
