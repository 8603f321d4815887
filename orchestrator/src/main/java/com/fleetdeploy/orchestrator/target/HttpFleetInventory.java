package com.fleetdeploy.orchestrator.target;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.config.DeployProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HTTP client for the fleet inventory service.
 *
 * GET /v1/instances?label=k=v&label=... returns every instance carrying all
 * the labels, with its current state. The call is made fresh for every
 * resolution; nothing is cached between runs.
 */
@Component
@ConditionalOnProperty(name = "fleetdeploy.fleet.source", havingValue = "http")
public class HttpFleetInventory implements FleetInventory {

    private static final Logger log = LoggerFactory.getLogger(HttpFleetInventory.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InstanceView(String id, String state, Map<String, String> labels) {}

    private static final TypeReference<List<InstanceView>> INSTANCE_LIST = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    @Autowired
    public HttpFleetInventory(DeployProperties properties, ObjectMapper objectMapper) {
        this(properties.getFleet().getInventoryUrl(), objectMapper,
                properties.getExecution().getConnectTimeout());
    }

    public HttpFleetInventory(String baseUrl, ObjectMapper objectMapper, Duration connectTimeout) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public List<Target> query(Map<String, String> labels) {
        String query = new TreeMap<>(labels).entrySet().stream()
                .map(e -> "label=" + URLEncoder.encode(e.getKey() + "=" + e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/instances?" + query))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new FleetInventoryException(
                        "Inventory query failed - HTTP " + resp.statusCode() + ": " + resp.body());
            }
            List<Target> targets = json.readValue(resp.body(), INSTANCE_LIST).stream()
                    .map(v -> new Target(v.id(), toLiveness(v.state()), v.labels()))
                    .toList();
            log.debug("Inventory returned {} instance(s) for {}", targets.size(), labels);
            return targets;
        } catch (FleetInventoryException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FleetInventoryException("Inventory query interrupted", e);
        } catch (Exception e) {
            throw new FleetInventoryException("Inventory query failed for " + labels, e);
        }
    }

    static Liveness toLiveness(String state) {
        if (state == null) return Liveness.UNKNOWN;
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "running"                               -> Liveness.ALIVE;
            case "stopped", "terminated", "unreachable"  -> Liveness.UNREACHABLE;
            default                                      -> Liveness.UNKNOWN;
        };
    }
}
