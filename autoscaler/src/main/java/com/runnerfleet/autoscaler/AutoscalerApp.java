package com.runnerfleet.autoscaler;

import com.runnerfleet.autoscaler.compute.KubernetesComputeProvisioner;
import com.runnerfleet.autoscaler.config.AutoscalerConfig;
import com.runnerfleet.autoscaler.controller.FleetController;
import com.runnerfleet.autoscaler.controller.OperationLimiter;
import com.runnerfleet.autoscaler.github.GitHubApiClient;
import com.runnerfleet.autoscaler.github.GitHubQueueObserver;
import com.runnerfleet.autoscaler.github.GitHubWorkerRegistry;
import com.runnerfleet.autoscaler.http.HttpServer;
import com.runnerfleet.autoscaler.kafka.IFleetEventPublisher;
import com.runnerfleet.autoscaler.kafka.KafkaFleetEventPublisher;
import com.runnerfleet.autoscaler.kafka.NoopFleetEventPublisher;
import com.runnerfleet.autoscaler.lifecycle.FleetLifecycleManager;
import com.runnerfleet.autoscaler.metrics.PrometheusMetricsExporter;
import com.runnerfleet.autoscaler.scale.ScaleDownSelector;
import com.runnerfleet.autoscaler.scale.ScalingPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.time.Duration;

public class AutoscalerApp {
    private static final Logger log = LoggerFactory.getLogger(AutoscalerApp.class);

    public static void main(String[] args) {
        AutoscalerConfig config = AutoscalerConfig.fromEnv();

        log.info("Starting runner fleet autoscaler");
        log.info("  Node: {}", config.getNodeId());
        log.info("  GitHub API: {}", config.getGithubApiUrl());
        log.info("  Namespace: {}", config.getKubernetesNamespace());
        log.info("  Kafka: {}", config.isEventPublishingEnabled() ? config.getKafkaBootstrap() : "disabled");

        Clock clock = Clock.systemUTC();

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MeterRegistry meterRegistry = metricsExporter.getRegistry();

        // Initialize components
        GitHubApiClient api = new GitHubApiClient(
            config.getGithubApiUrl(),
            config.getGithubToken(),
            config.getApiTimeout(),
            config.getRateLimitMaxRetries(),
            config.getRateLimitBackoff(),
            meterRegistry
        );
        KubernetesComputeProvisioner compute = new KubernetesComputeProvisioner(
            config.getKubernetesNamespace(),
            config.getRunnerImage(),
            config.getPodReadyTimeout()
        );
        GitHubWorkerRegistry registry = new GitHubWorkerRegistry(
            api, compute, config.getGithubServerUrl(), config.getRegistrationCommandTimeout(), clock
        );
        GitHubQueueObserver queueObserver = new GitHubQueueObserver(api, config.getApiTimeout(), clock);
        FleetLifecycleManager lifecycle = new FleetLifecycleManager(
            registry, compute, clock, config.getOnlineWaitTimeout(), config.getOnlinePollInterval(), meterRegistry
        );
        IFleetEventPublisher publisher = config.isEventPublishingEnabled()
            ? new KafkaFleetEventPublisher(config)
            : new NoopFleetEventPublisher();

        OperationLimiter limiter = new OperationLimiter(config.getMaxConcurrentOperations(), meterRegistry);
        FleetController controller = new FleetController(
            queueObserver,
            new ScalingPolicy(clock),
            new ScaleDownSelector(),
            lifecycle,
            limiter,
            publisher,
            meterRegistry,
            clock,
            config.getTickInterval(),
            config.getDegradedAfterRounds()
        );

        // Start HTTP server
        HttpServer httpServer = new HttpServer(config, controller, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("Autoscaler is ready");

        handleShutDown(controller, limiter, httpServer, publisher, compute);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        FleetController controller,
        OperationLimiter limiter,
        HttpServer httpServer,
        IFleetEventPublisher publisher,
        KubernetesComputeProvisioner compute
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            // lets in-flight operations finish so no instance is orphaned
            try {
                controller.shutdown().block(Duration.ofMinutes(5));
            } catch (RuntimeException e) {
                log.error("Fleets did not stop cleanly: {}", e.getMessage());
            }

            limiter.close();

            publisher.close();

            compute.close();

            log.info("Shutdown complete");
        }));
    }
}
