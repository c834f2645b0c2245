package com.runnerfleet.autoscaler.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.runnerfleet.core.error.QueueObservationException;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.QueueMetrics;
import com.runnerfleet.core.util.SecretRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Derives queue metrics from GitHub Actions workflow runs.
 * <p>
 * Lists queued and in-progress runs, fetches their jobs and counts only the jobs whose
 * {@code runs-on} labels include every label of the fleet (label matching is
 * case-insensitive, as on GitHub).
 * </p>
 */
public class GitHubQueueObserver implements IQueueObserver {
    private static final Logger log = LoggerFactory.getLogger(GitHubQueueObserver.class);

    static final int PER_PAGE = 100;
    static final int MAX_RUN_PAGES = 10;
    static final int MAX_JOB_PAGES = 10;
    private static final int JOB_FETCH_CONCURRENCY = 4;
    private static final List<String> RUN_STATUSES = List.of("queued", "in_progress");

    private final GitHubApiClient api;
    private final Duration timeout;
    private final Clock clock;

    public GitHubQueueObserver(GitHubApiClient api, Duration timeout, Clock clock) {
        this.api = api;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public Mono<QueueMetrics> metrics(FleetConfig fleet) {
        Set<String> required = lowercase(fleet.getLabels());

        return Flux.fromIterable(RUN_STATUSES)
            .concatMap(status -> listRunIds(fleet, status))
            .distinct()
            .flatMap(runId -> listJobs(fleet, runId), JOB_FETCH_CONCURRENCY)
            .distinct(job -> job.path("id").asLong())
            .filter(job -> lowercase(labelsOf(job)).containsAll(required))
            .collect(JobCounts::new, JobCounts::add)
            .map(counts -> counts.toMetrics(clock))
            .timeout(timeout)
            .doOnNext(metrics -> log.debug("Queue for fleet {}: pending={}, queued={}, inProgress={}",
                fleet.getName(), metrics.getPendingJobs(), metrics.getQueuedJobs(), metrics.getInProgressJobs()))
            .onErrorMap(err -> !(err instanceof QueueObservationException), err -> new QueueObservationException(
                "Failed to observe queue for " + fleet.getRepository() + ": " + describe(err), err));
    }

    private Flux<Long> listRunIds(FleetConfig fleet, String status) {
        String path = String.format("/repos/%s/%s/actions/runs?status=%s",
            fleet.getRepoOwner(), fleet.getRepoName(), status);
        return listPaged("list_runs", path, "workflow_runs", MAX_RUN_PAGES, status + " workflow runs")
            .map(run -> run.path("id").asLong());
    }

    private Flux<JsonNode> listJobs(FleetConfig fleet, long runId) {
        String path = String.format("/repos/%s/%s/actions/runs/%d/jobs?filter=latest",
            fleet.getRepoOwner(), fleet.getRepoName(), runId);
        return listPaged("list_jobs", path, "jobs", MAX_JOB_PAGES, "jobs of run " + runId);
    }

    /**
     * Follows {@code page=N} until {@code total_count} items were seen, an empty page comes back,
     * or {@code maxPages} is reached. Hitting the cap with items left is logged, and the
     * items beyond it are not counted.
     */
    private Flux<JsonNode> listPaged(String operation, String path, String field, int maxPages, String what) {
        return fetchPage(operation, path, field, 1, maxPages, what)
            .expand(page -> page.hasNext()
                ? fetchPage(operation, path, field, page.number() + 1, maxPages, what)
                : Mono.empty())
            .flatMapIterable(Page::items);
    }

    private Mono<Page> fetchPage(String operation, String path, String field, int page, int maxPages, String what) {
        String uri = path + "&per_page=" + PER_PAGE + "&page=" + page;

        return api.get(operation, uri).flatMap(response -> {
            if (!response.is(200)) {
                return Mono.error(new QueueObservationException(
                    "Failed to list " + what + ": " + response.status() + " - " + response.errorMessage()));
            }
            JsonNode json = response.json();
            List<JsonNode> items = new ArrayList<>();
            json.path(field).forEach(items::add);
            int total = json.path("total_count").asInt(items.size());
            boolean more = !items.isEmpty() && (long) page * PER_PAGE < total;
            if (more && page >= maxPages) {
                log.warn("Provider reports {} {}, counting only the first {}", total, what, maxPages * PER_PAGE);
                more = false;
            }
            return Mono.just(new Page(page, items, more));
        });
    }

    private static List<String> labelsOf(JsonNode job) {
        List<String> labels = new ArrayList<>();
        job.path("labels").forEach(label -> labels.add(label.asText()));
        return labels;
    }

    private static Set<String> lowercase(List<String> labels) {
        Set<String> result = new HashSet<>();
        labels.forEach(label -> result.add(label.toLowerCase(Locale.ROOT)));
        return result;
    }

    private String describe(Throwable err) {
        if (err instanceof TimeoutException) {
            return "timed out after " + timeout.toSeconds() + "s";
        }
        return SecretRedactor.describe(err);
    }

    private record Page(int number, List<JsonNode> items, boolean hasNext) {
    }

    /**
     * Mutable accumulator, confined to a single collect operation.
     */
    private static final class JobCounts {
        private int pending;
        private int queued;
        private int inProgress;

        void add(JsonNode job) {
            switch (job.path("status").asText()) {
                case "queued":
                    queued++;
                    pending++;
                    break;
                case "waiting":
                case "pending":
                case "requested":
                    pending++;
                    break;
                case "in_progress":
                    inProgress++;
                    break;
                default:
                    // completed jobs of a still-running workflow
                    break;
            }
        }

        QueueMetrics toMetrics(Clock clock) {
            return QueueMetrics.builder()
                .pendingJobs(pending)
                .queuedJobs(queued)
                .inProgressJobs(inProgress)
                .totalJobs(pending + inProgress)
                .timestamp(clock.instant())
                .build();
        }
    }
}
