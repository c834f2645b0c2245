package com.runnerfleet.autoscaler.github;

import com.runnerfleet.core.error.RateLimitedException;
import com.runnerfleet.core.metrics.MetricsNames;
import com.runnerfleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Thin GitHub REST client on top of reactor-netty's HttpClient.
 * <p>
 * Every call carries its own deadline. Rate-limit responses (HTTP 429, or 403 with an
 * exhausted quota) are retried with jittered exponential backoff a bounded number of times;
 * when retries run out the last {@link RateLimitedException} is propagated to the caller,
 * which maps it to its own typed failure.
 * </p>
 */
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private static final String API_VERSION = "2022-11-28";
    private static final String ACCEPT = "application/vnd.github+json";
    private static final String RATE_LIMIT_REMAINING = "x-ratelimit-remaining";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;
    private final MeterRegistry meterRegistry;

    /**
     * @param baseUrl    API root, e.g. {@code https://api.github.com}
     * @param token      provider access token; only ever placed in the Authorization header
     * @param timeout    deadline for a single request
     * @param maxRetries retries after a rate-limit response
     * @param backoff    first backoff delay, doubled per retry
     */
    public GitHubApiClient(String baseUrl, String token, Duration timeout, int maxRetries,
                           Duration backoff, MeterRegistry meterRegistry) {
        this.httpClient = HttpClient.create()
            .baseUrl(baseUrl)
            .headers(h -> h
                .set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token)
                .set(HttpHeaderNames.ACCEPT, ACCEPT)
                .set(HttpHeaderNames.USER_AGENT, "runner-fleet-autoscaler")
                .set("X-GitHub-Api-Version", API_VERSION))
            .responseTimeout(timeout);
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.meterRegistry = meterRegistry;

        log.info("GitHub API client initialized for {} (timeout={}s, rateLimitRetries={})",
            baseUrl, timeout.toSeconds(), maxRetries);
    }

    public Mono<ApiResponse> get(String operation, String uri) {
        return exchange(operation, HttpMethod.GET, uri);
    }

    public Mono<ApiResponse> post(String operation, String uri) {
        return exchange(operation, HttpMethod.POST, uri);
    }

    public Mono<ApiResponse> delete(String operation, String uri) {
        return exchange(operation, HttpMethod.DELETE, uri);
    }

    private Mono<ApiResponse> exchange(String operation, HttpMethod method, String uri) {
        Counter rateLimited = Counter.builder(MetricsNames.GITHUB_RATE_LIMITED_TOTAL)
            .tag(MetricsTags.OPERATION, operation)
            .register(meterRegistry);

        return Mono.defer(() -> httpClient.request(method)
                .uri(uri)
                .responseSingle((response, body) -> {
                    int status = response.status().code();
                    if (isRateLimited(status, response.responseHeaders().get(RATE_LIMIT_REMAINING))) {
                        return Mono.error(new RateLimitedException(operation, status));
                    }
                    return body.asString()
                        .defaultIfEmpty("")
                        .map(text -> new ApiResponse(status, text));
                })
                .timeout(timeout))
            .doOnError(RateLimitedException.class, err -> {
                rateLimited.increment();
                log.warn("GitHub {} rate limited (HTTP {}), backing off", operation, err.getStatusCode());
            })
            .retryWhen(Retry.backoff(maxRetries, backoff)
                .filter(RateLimitedException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    static boolean isRateLimited(int status, String remainingHeader) {
        if (status == HttpResponseStatus.TOO_MANY_REQUESTS.code()) {
            return true;
        }
        return status == HttpResponseStatus.FORBIDDEN.code() && "0".equals(remainingHeader);
    }
}
