package com.fleetdeploy.orchestrator.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.config.DeployProperties;
import com.fleetdeploy.orchestrator.executor.CommandStatus;
import com.fleetdeploy.orchestrator.executor.ExecutionCredential;
import com.fleetdeploy.orchestrator.executor.HttpRemoteExecutionClient;
import com.fleetdeploy.orchestrator.stage.RunBindings;
import com.fleetdeploy.orchestrator.stage.StageCatalog;
import com.fleetdeploy.orchestrator.stage.StageDefinition;
import com.fleetdeploy.orchestrator.stage.StageName;
import com.fleetdeploy.orchestrator.stage.StageRunner;
import com.fleetdeploy.orchestrator.stage.SuccessPredicate;
import com.fleetdeploy.orchestrator.target.Liveness;
import com.fleetdeploy.orchestrator.target.StaticFleetInventory;
import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.target.TargetResolver;
import com.fleetdeploy.orchestrator.target.TargetSelector;
import com.fleetdeploy.orchestrator.template.CommandTemplateEngine;
import com.fleetdeploy.orchestrator.template.TemplateCatalog;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full pipeline against the real HTTP agent client, with an in-process
 * server playing an agent that misbehaves.
 */
class PipelineOverHttpAgentTest {

    private static final Map<String, String> WEB = Map.of("fleet", "web");

    private HttpServer      server;
    private ExecutorService handlers;

    // agent behaviour, set per test
    private volatile String dispatchBody  = "{\"command_id\":\"cmd-1\"}";
    private volatile long   statusDelayMs = 0;
    private final AtomicInteger dispatches = new AtomicInteger();

    @BeforeEach
    void start() throws IOException {
        handlers = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/targets/", exchange -> {
            exchange.getRequestBody().readAllBytes();
            dispatches.incrementAndGet();
            respond(exchange, 201, dispatchBody);
        });
        server.createContext("/v1/commands/", exchange -> {
            if (statusDelayMs > 0) {
                try {
                    Thread.sleep(statusDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            respond(exchange, 200, "{\"status\":\"SUCCESS\",\"exit_code\":0,"
                    + "\"output\":\"DOCKER_READY PULL_OK SWAP_OK HEALTH_OK\"}");
        });
        server.setExecutor(handlers);
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    void healthyAgent_completes() {
        PipelineRun run = deploy();

        assertThat(run.verdict().isCompleted()).isTrue();
        assertThat(dispatches.get()).isEqualTo(4);
    }

    @Test
    void dispatchAcceptedWithoutCommandId_abortsAtStage1InsteadOfThrowing() {
        dispatchBody = "{\"id\":\"x\"}";

        PipelineRun run = deploy();

        assertThat(run.verdict().describe()).isEqualTo("AbortedAtStage(1)");
        assertThat(run.attempted()).isTrue();
        assertThat(run.stages()).hasSize(1);
        assertThat(run.stages().get(0).outcome().status()).isEqualTo(CommandStatus.FAILURE);
        assertThat(dispatches.get()).isEqualTo(1);
    }

    @Test
    void statusNeverAnswered_stageTimesOutWithinItsBudget() {
        statusDelayMs = 5_000;

        long started = System.nanoTime();
        PipelineRun run = deploy();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(run.verdict().describe()).isEqualTo("AbortedAtStage(1)");
        assertThat(run.stages().get(0).outcome().status()).isEqualTo(CommandStatus.TIMED_OUT);
        assertThat(elapsed).isLessThan(Duration.ofSeconds(2));
        assertThat(dispatches.get()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineRun deploy() {
        DeployProperties properties = new DeployProperties();
        properties.getResolution().setInitialBackoff(Duration.ZERO);
        HttpRemoteExecutionClient client = new HttpRemoteExecutionClient(
                "http://127.0.0.1:" + server.getAddress().getPort(), new ObjectMapper(),
                Duration.ofMillis(20), Duration.ofSeconds(2), 64 * 1024);
        StageCatalog catalog = new StageCatalog(List.of(
                stage(StageName.DEPENDENCY_CHECK, "dependency-check"),
                stage(StageName.ARTIFACT_PULL, "artifact-pull"),
                stage(StageName.DEPLOY_SWAP, "deploy-swap"),
                stage(StageName.HEALTH_CHECK, "health-check")));
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                new TargetResolver(new StaticFleetInventory(List.of(new Target("i-1", Liveness.ALIVE, WEB)))),
                new StageRunner(new TemplateCatalog(), new CommandTemplateEngine(), client),
                catalog, new RunBindings(properties), () -> new ExecutionCredential("run-token"),
                new SimpleMeterRegistry(), properties);
        return orchestrator.deploy(TargetSelector.alive(WEB), "registry.example.com/web:1.4.2");
    }

    private static StageDefinition stage(StageName name, String template) {
        return new StageDefinition(name, template, Duration.ofMillis(300), SuccessPredicate.successWithMarker(null));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
