package com.fleetdeploy.orchestrator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.executor.dto.CommandStatusResponse;
import com.fleetdeploy.orchestrator.target.Liveness;
import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.template.RenderedCommand;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the execution agent client against an in-process HTTP server
 * that plays the agent.
 */
class HttpRemoteExecutionClientTest {

    private static final Target TARGET = new Target("i-web-1", Liveness.ALIVE, Map.of("fleet", "web"));
    private static final RenderedCommand COMMAND = new RenderedCommand("deploy-swap", "echo SWAP_OK");

    private final ObjectMapper json = new ObjectMapper();

    private HttpServer server;
    private HttpRemoteExecutionClient client;

    // agent behaviour, set per test
    private volatile int    dispatchStatus = 201;
    private volatile String dispatchBody   = "{\"command_id\":\"cmd-1\"}";
    private volatile long   statusDelayMs  = 0;
    private final Deque<String> statusBodies = new ConcurrentLinkedDeque<>();
    private final ExecutorService handlers   = Executors.newCachedThreadPool();

    private final AtomicReference<String> lastDispatch = new AtomicReference<>();
    private final AtomicReference<String> lastAuth     = new AtomicReference<>();
    private final AtomicInteger           statusCalls  = new AtomicInteger();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/targets/", exchange -> {
            lastDispatch.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, dispatchStatus, dispatchBody);
        });
        server.createContext("/v1/commands/", exchange -> {
            statusCalls.incrementAndGet();
            if (statusDelayMs > 0) {
                try {
                    Thread.sleep(statusDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            String next = statusBodies.size() > 1 ? statusBodies.poll() : statusBodies.peek();
            respond(exchange, 200, next == null ? "{\"status\":\"PENDING\"}" : next);
        });
        server.setExecutor(handlers);
        server.start();
        client = clientWithMaxOutput(64 * 1024);
    }

    @AfterEach
    void stop() {
        server.stop(0);
        handlers.shutdownNow();
        MDC.clear();
    }

    // ------------------------------------------------------------------
    // dispatch
    // ------------------------------------------------------------------

    @Test
    void dispatch_postsScriptAndReturnsHandle() throws Exception {
        MDC.put("runId", "run-42");

        CommandHandle handle = client.dispatch(TARGET, COMMAND, new ExecutionCredential("tok"));

        assertThat(handle.commandId()).isEqualTo("cmd-1");
        assertThat(handle.targetId()).isEqualTo("i-web-1");
        JsonNode body = json.readTree(lastDispatch.get());
        assertThat(body.get("run_id").asText()).isEqualTo("run-42");
        assertThat(body.get("template").asText()).isEqualTo("deploy-swap");
        assertThat(body.get("script").asText()).isEqualTo("echo SWAP_OK");
        assertThat(lastAuth.get()).isEqualTo("Bearer tok");
    }

    @Test
    void dispatch_withoutCredential_sendsNoAuthorizationHeader() {
        client.dispatch(TARGET, COMMAND, ExecutionCredential.NONE);

        assertThat(lastAuth.get()).isNull();
    }

    @Test
    void dispatch_503_isTargetUnreachable() {
        dispatchStatus = 503;
        dispatchBody   = "{\"error\":\"agent offline\"}";

        assertThatThrownBy(() -> client.dispatch(TARGET, COMMAND, ExecutionCredential.NONE))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getKind())
                .isEqualTo(DispatchException.Kind.TARGET_UNREACHABLE);
    }

    @Test
    void dispatch_400_isRejected() {
        dispatchStatus = 400;
        dispatchBody   = "{\"error\":\"bad script\"}";

        assertThatThrownBy(() -> client.dispatch(TARGET, COMMAND, ExecutionCredential.NONE))
                .isInstanceOf(DispatchException.class)
                .hasMessageStartingWith("[REJECTED]")
                .extracting(e -> ((DispatchException) e).getTargetId())
                .isEqualTo("i-web-1");
    }

    @Test
    void dispatch_agentDown_isTargetUnreachable() {
        HttpRemoteExecutionClient nowhere = new HttpRemoteExecutionClient("http://127.0.0.1:1", json,
                Duration.ofMillis(20), Duration.ofSeconds(2), 1024);

        assertThatThrownBy(() -> nowhere.dispatch(TARGET, COMMAND, ExecutionCredential.NONE))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getKind())
                .isEqualTo(DispatchException.Kind.TARGET_UNREACHABLE);
    }

    @Test
    void dispatch_missingCommandId_throwsExecutorException() {
        dispatchBody = "{}";

        assertThatThrownBy(() -> client.dispatch(TARGET, COMMAND, ExecutionCredential.NONE))
                .isInstanceOf(ExecutorException.class);
    }

    // ------------------------------------------------------------------
    // poll
    // ------------------------------------------------------------------

    @Test
    void poll_waitsThroughInFlightStatuses() {
        statusBodies.add("{\"status\":\"PENDING\"}");
        statusBodies.add("{\"status\":\"IN_PROGRESS\",\"output\":\"pulling\"}");
        statusBodies.add("{\"status\":\"SUCCESS\",\"exit_code\":0,\"output\":\"PULL_OK\"}");

        CommandOutcome outcome = client.poll(handle(), Duration.ofSeconds(5));

        assertThat(outcome.status()).isEqualTo(CommandStatus.SUCCESS);
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.output()).isEqualTo("PULL_OK");
        assertThat(statusCalls.get()).isEqualTo(3);
    }

    @Test
    void poll_nonZeroExit_isFailure() {
        statusBodies.add("{\"status\":\"FAILED\",\"exit_code\":125,\"output\":\"no such image\"}");

        CommandOutcome outcome = client.poll(handle(), Duration.ofSeconds(5));

        assertThat(outcome.status()).isEqualTo(CommandStatus.FAILURE);
        assertThat(outcome.exitCode()).isEqualTo(125);
    }

    @Test
    void poll_neverTerminal_timesOutWithLastOutput() {
        statusBodies.add("{\"status\":\"IN_PROGRESS\",\"output\":\"still going\"}");

        CommandOutcome outcome = client.poll(handle(), Duration.ofMillis(150));

        assertThat(outcome.status()).isEqualTo(CommandStatus.TIMED_OUT);
        assertThat(outcome.exitCode()).isNull();
        assertThat(outcome.output()).isEqualTo("still going");
    }

    @Test
    void poll_agentStallsOnStatus_timesOutNearDeadline() {
        statusDelayMs = 3_000;
        statusBodies.add("{\"status\":\"SUCCESS\",\"exit_code\":0,\"output\":\"late\"}");

        long started = System.nanoTime();
        CommandOutcome outcome = client.poll(handle(), Duration.ofMillis(200));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.status()).isEqualTo(CommandStatus.TIMED_OUT);
        assertThat(outcome.exitCode()).isNull();
        assertThat(elapsed).isLessThan(Duration.ofMillis(1_500));
    }

    @Test
    void requestTimeout_boundedByDeadlineFloorAndCap() {
        Instant now = Instant.now();

        assertThat(HttpRemoteExecutionClient.requestTimeout(now.plusSeconds(5)))
                .isBetween(Duration.ofSeconds(4), Duration.ofSeconds(5));
        assertThat(HttpRemoteExecutionClient.requestTimeout(now.minusSeconds(1))).isEqualTo(Duration.ofMillis(50));
        assertThat(HttpRemoteExecutionClient.requestTimeout(now.plusSeconds(600))).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void poll_zeroTimeout_stillChecksOnce() {
        statusBodies.add("{\"status\":\"SUCCESS\",\"exit_code\":0,\"output\":\"ok\"}");

        CommandOutcome outcome = client.poll(handle(), Duration.ZERO);

        assertThat(outcome.status()).isEqualTo(CommandStatus.SUCCESS);
    }

    @Test
    void poll_repeatedAfterTerminal_replaysWithoutNetwork() {
        statusBodies.add("{\"status\":\"SUCCESS\",\"exit_code\":0,\"output\":\"HEALTH_OK\"}");
        CommandHandle handle = handle();

        CommandOutcome first  = client.poll(handle, Duration.ofSeconds(5));
        CommandOutcome second = client.poll(handle, Duration.ofSeconds(5));

        assertThat(second).isEqualTo(first);
        assertThat(statusCalls.get()).isEqualTo(1);
    }

    @Test
    void poll_longOutput_keepsTailAndFlagsTruncation() {
        client = clientWithMaxOutput(8);
        statusBodies.add("{\"status\":\"SUCCESS\",\"exit_code\":0,\"output\":\"0123456789ABCDEF\"}");

        CommandOutcome outcome = client.poll(handle(), Duration.ofSeconds(5));

        assertThat(outcome.output()).isEqualTo("89ABCDEF");
        assertThat(outcome.truncated()).isTrue();
    }

    @Test
    void toOutcome_mapsAgentStatuses() {
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("PENDING", null, ""))).isEmpty();
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("SUCCESS", null, "ok")))
                .hasValueSatisfying(o -> {
                    assertThat(o.status()).isEqualTo(CommandStatus.SUCCESS);
                    assertThat(o.exitCode()).isNull();
                });
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("SUCCESS", 3, "")))
                .hasValueSatisfying(o -> assertThat(o.status()).isEqualTo(CommandStatus.FAILURE));
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("CANCELLED", null, "")))
                .hasValueSatisfying(o -> assertThat(o.status()).isEqualTo(CommandStatus.FAILURE));
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("TIMED_OUT", null, "")))
                .hasValueSatisfying(o -> assertThat(o.status()).isEqualTo(CommandStatus.TIMED_OUT));
        assertThat(HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("UNDELIVERABLE", null, "")))
                .hasValueSatisfying(o -> assertThat(o.status()).isEqualTo(CommandStatus.TARGET_UNREACHABLE));
        assertThatThrownBy(() -> HttpRemoteExecutionClient.toOutcome(new CommandStatusResponse("WEIRD", null, "")))
                .isInstanceOf(ExecutorException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpRemoteExecutionClient clientWithMaxOutput(int maxOutputChars) {
        return new HttpRemoteExecutionClient("http://127.0.0.1:" + server.getAddress().getPort(), json,
                Duration.ofMillis(20), Duration.ofSeconds(2), maxOutputChars);
    }

    private static CommandHandle handle() {
        return new CommandHandle("cmd-" + System.nanoTime(), TARGET.id(), Instant.now(), ExecutionCredential.NONE);
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
