package com.fleetdeploy.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.config.DeployProperties;
import com.fleetdeploy.orchestrator.executor.dto.CommandStatusResponse;
import com.fleetdeploy.orchestrator.executor.dto.DispatchRequest;
import com.fleetdeploy.orchestrator.executor.dto.DispatchResponse;
import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.template.RenderedCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * HTTP client for the remote execution agent.
 *
 * <pre>
 *   POST /v1/targets/{targetId}/commands   -> {command_id}      (dispatch)
 *   GET  /v1/commands/{commandId}          -> {status, exit_code, output}
 * </pre>
 *
 * Dispatch returns as soon as the agent has queued the command. Poll checks
 * the status every {@code poll-interval} until it is terminal or the caller's
 * timeout runs out. Terminal outcomes are memoised per command id so a
 * repeated poll is an exact, network-free replay.
 */
@Component
public class HttpRemoteExecutionClient implements RemoteExecutionClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteExecutionClient.class);

    // Agent answers that mean "this target cannot take commands now".
    private static final Set<Integer> UNREACHABLE_CODES = Set.of(404, 409, 503, 504);

    private static final int MAX_REMEMBERED_OUTCOMES = 1024;

    // Per-request bounds for status checks; the caller's deadline narrows the cap.
    private static final Duration STATUS_REQUEST_CAP   = Duration.ofSeconds(30);
    private static final Duration STATUS_REQUEST_FLOOR = Duration.ofMillis(50);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     pollInterval;
    private final int          maxOutputChars;

    private final Map<String, CommandOutcome> terminal = Collections.synchronizedMap(
            new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CommandOutcome> eldest) {
                    return size() > MAX_REMEMBERED_OUTCOMES;
                }
            });

    @Autowired
    public HttpRemoteExecutionClient(DeployProperties properties, ObjectMapper objectMapper) {
        this(properties.getExecution().getAgentUrl(),
             objectMapper,
             properties.getExecution().getPollInterval(),
             properties.getExecution().getConnectTimeout(),
             properties.getExecution().getMaxOutputChars());
    }

    public HttpRemoteExecutionClient(String baseUrl, ObjectMapper objectMapper, Duration pollInterval,
                                     Duration connectTimeout, int maxOutputChars) {
        this.baseUrl        = baseUrl;
        this.json           = objectMapper;
        this.pollInterval   = pollInterval;
        this.maxOutputChars = maxOutputChars;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @Override
    public CommandHandle dispatch(Target target, RenderedCommand command, ExecutionCredential credential) {
        String body = toJson(new DispatchRequest(
                MDC.get("runId"), command.templateName(), command.script()));
        HttpRequest req = request("/v1/targets/" + encode(target.id()) + "/commands", credential)
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DispatchException(DispatchException.Kind.TARGET_UNREACHABLE, target.id(),
                    "agent unreachable while dispatching " + command.templateName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(DispatchException.Kind.TARGET_UNREACHABLE, target.id(),
                    "dispatch interrupted", e);
        }

        int code = resp.statusCode();
        if (UNREACHABLE_CODES.contains(code)) {
            throw new DispatchException(DispatchException.Kind.TARGET_UNREACHABLE, target.id(),
                    "target " + target.id() + " cannot accept commands - HTTP " + code + ": " + resp.body());
        }
        if (code < 200 || code >= 300) {
            throw new DispatchException(DispatchException.Kind.REJECTED, target.id(),
                    "dispatch of " + command.templateName() + " rejected - HTTP " + code + ": " + resp.body());
        }

        String commandId;
        try {
            commandId = json.readValue(resp.body(), DispatchResponse.class).command_id();
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse dispatch response", e);
        }
        if (commandId == null || commandId.isBlank()) {
            throw new ExecutorException("Dispatch response carried no command_id: " + resp.body());
        }
        log.info("Dispatched '{}' to {} as command {}", command.templateName(), target.id(), commandId);
        return new CommandHandle(commandId, target.id(), Instant.now(), credential);
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    @Override
    public CommandOutcome poll(CommandHandle handle, Duration timeout) {
        CommandOutcome known = terminal.get(handle.commandId());
        if (known != null) {
            return known;
        }

        Instant deadline = Instant.now().plus(timeout);
        String lastOutput = "";
        int checks = 0;
        while (true) {
            checks++;
            try {
                CommandStatusResponse status = fetchStatus(handle, requestTimeout(deadline));
                if (status.output() != null) {
                    lastOutput = status.output();
                }
                Optional<CommandOutcome> outcome = toOutcome(status);
                if (outcome.isPresent()) {
                    CommandOutcome result = outcome.get().truncatedTo(maxOutputChars);
                    terminal.put(handle.commandId(), result);
                    log.info("Command {} finished {} after {} status check(s)",
                            handle.commandId(), result.status(), checks);
                    return result;
                }
                log.debug("Command {} still {}", handle.commandId(), status.status());
            } catch (ExecutorException e) {
                // keep polling until the deadline
                log.warn("Status check {} for command {} failed: {}", checks, handle.commandId(), e.getMessage());
            }

            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                log.warn("Command {} not terminal within {}", handle.commandId(), timeout);
                return CommandOutcome.timedOut(lastOutput).truncatedTo(maxOutputChars);
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining.toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CommandOutcome.timedOut(lastOutput).truncatedTo(maxOutputChars);
            }
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private CommandStatusResponse fetchStatus(CommandHandle handle, Duration requestTimeout) {
        HttpRequest req = request("/v1/commands/" + encode(handle.commandId()), handle.credential())
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        "status of " + handle.commandId() + " - HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readValue(resp.body(), CommandStatusResponse.class);
        } catch (ExecutorException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ExecutorException("status check for " + handle.commandId()
                    + " got no answer within " + requestTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("status check interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException("status check failed for " + handle.commandId(), e);
        }
    }

    /** Time left before the deadline, never above the cap and never below the floor. */
    static Duration requestTimeout(Instant deadline) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.compareTo(STATUS_REQUEST_FLOOR) < 0) return STATUS_REQUEST_FLOOR;
        if (remaining.compareTo(STATUS_REQUEST_CAP) > 0)   return STATUS_REQUEST_CAP;
        return remaining;
    }

    /** Map the agent's status to an outcome; empty while the command is still running. */
    static Optional<CommandOutcome> toOutcome(CommandStatusResponse status) {
        if (status.status() == null || status.inFlight()) {
            return Optional.empty();
        }
        String output = status.output();
        return switch (status.status()) {
            case "SUCCESS"             -> Optional.of(status.exit_code() == null || status.exit_code() == 0
                                                ? CommandOutcome.success(output, status.exit_code())
                                                : CommandOutcome.failure(output, status.exit_code()));
            case "FAILED", "CANCELLED" -> Optional.of(CommandOutcome.failure(output, status.exit_code()));
            case "TIMED_OUT"           -> Optional.of(CommandOutcome.timedOut(output));
            case "UNDELIVERABLE"       -> Optional.of(CommandOutcome.targetUnreachable(output));
            default -> throw new ExecutorException("Unknown command status '" + status.status() + "'");
        };
    }

    private HttpRequest.Builder request(String path, ExecutionCredential credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json");
        if (credential != null && credential.isPresent()) {
            builder.header("Authorization", "Bearer " + credential.token());
        }
        return builder;
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
