package com.runnerfleet.autoscaler.http;

import com.runnerfleet.autoscaler.config.AutoscalerConfig;
import com.runnerfleet.autoscaler.controller.FleetController;
import com.runnerfleet.autoscaler.controller.FleetStatus;
import com.runnerfleet.autoscaler.metrics.PrometheusMetricsExporter;
import com.runnerfleet.core.error.ProvisioningException;
import com.runnerfleet.core.error.QueueObservationException;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.util.JsonUtils;
import com.runnerfleet.core.util.SecretRedactor;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * HTTP server for the operator API.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String FLEET = "/api/v1/fleets/{name}";

    private final AutoscalerConfig config;
    private final FleetController controller;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(AutoscalerConfig config, FleetController controller, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.controller = controller;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Status of every fleet
            .get("/api/v1/fleets", (req, res) ->
                json(res, HttpResponseStatus.OK, controller.statuses())
            )
            // Status of one fleet
            .get(FLEET, (req, res) ->
                controller.status(req.param("name"))
                    .map(status -> json(res, HttpResponseStatus.OK, status))
                    .orElseGet(() -> error(res, new NoSuchElementException("Fleet " + req.param("name") + " is not enabled")))
            )
            // Enable
            .post(FLEET, (req, res) ->
                body(req, EnableFleetRequest.class)
                    .map(request -> {
                        FleetConfig fleet = request.toFleetConfig(req.param("name"));
                        ScalingConfig scaling = request.getScaling() != null
                            ? request.getScaling().applyTo(ScalingConfig.defaults())
                            : ScalingConfig.defaults();
                        return controller.enable(fleet, scaling);
                    })
                    .flatMap(status -> json(res, HttpResponseStatus.CREATED, status))
                    .onErrorResume(err -> error(res, err))
            )
            // Replace scaling parameters
            .put(FLEET + "/scaling", (req, res) ->
                body(req, ScalingRequest.class)
                    .flatMap(request -> {
                        String name = req.param("name");
                        FleetStatus current = controller.status(name)
                            .orElseThrow(() -> new NoSuchElementException("Fleet " + name + " is not enabled"));
                        return controller.updateScaling(name, request.applyTo(current.getScaling()));
                    })
                    .flatMap(status -> json(res, HttpResponseStatus.OK, status))
                    .onErrorResume(err -> error(res, err))
            )
            // Disable, optionally destroying every worker first
            .delete(FLEET, (req, res) -> {
                boolean drain = Boolean.parseBoolean(query(req, "drain", "false"));
                return controller.disable(req.param("name"), drain)
                    .flatMap(status -> json(res, HttpResponseStatus.OK, status))
                    .onErrorResume(err -> error(res, err));
            })
            // Manual scale
            .post(FLEET + "/scale", (req, res) ->
                Mono.fromCallable(() -> Integer.parseInt(query(req, "count", "")))
                    .onErrorMap(NumberFormatException.class,
                        err -> new IllegalArgumentException("count must be an integer"))
                    .flatMap(count -> controller.scaleTo(req.param("name"), count))
                    .flatMap(decision -> json(res, HttpResponseStatus.OK, decision))
                    .onErrorResume(err -> error(res, err))
            )
            // Tick now
            .post(FLEET + "/evaluate", (req, res) ->
                controller.evaluateNow(req.param("name"))
                    .map(decision -> (Object) decision)
                    // a fleet that is being disabled no longer ticks
                    .defaultIfEmpty(Map.of("status", "skipped"))
                    .flatMap(body -> json(res, HttpResponseStatus.OK, body))
                    .onErrorResume(err -> error(res, err))
            )
            // Rotate one worker
            .post(FLEET + "/workers/{worker}/rotate", (req, res) ->
                controller.rotateWorker(req.param("name"), req.param("worker"))
                    .flatMap(replacement -> json(res, HttpResponseStatus.OK, replacement))
                    .onErrorResume(err -> error(res, err))
            );
    }

    private static <T> Mono<T> body(HttpServerRequest req, Class<T> type) {
        return req.receive().aggregate().asString()
            .switchIfEmpty(Mono.error(new IllegalArgumentException("Request body is required")))
            .map(text -> JsonUtils.readValue(text, type));
    }

    private static String query(HttpServerRequest req, String name, String defaultValue) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    private static Mono<Void> json(HttpServerResponse res, HttpResponseStatus status, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json -> res.status(status)
                .header("Content-Type", "application/json")
                .sendString(Mono.just(json))
                .then());
    }

    private static Mono<Void> error(HttpServerResponse res, Throwable err) {
        HttpResponseStatus status;
        if (err instanceof IllegalArgumentException || err instanceof UncheckedIOException) {
            status = HttpResponseStatus.BAD_REQUEST;
        } else if (err instanceof NoSuchElementException) {
            status = HttpResponseStatus.NOT_FOUND;
        } else if (err instanceof IllegalStateException) {
            status = HttpResponseStatus.CONFLICT;
        } else if (err instanceof QueueObservationException) {
            status = HttpResponseStatus.SERVICE_UNAVAILABLE;
        } else if (err instanceof ProvisioningException) {
            status = HttpResponseStatus.BAD_GATEWAY;
        } else {
            log.error("Request failed", err);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
        }
        String message = SecretRedactor.describe(err);
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(Map.of("error", message))))
            .then();
    }
}
