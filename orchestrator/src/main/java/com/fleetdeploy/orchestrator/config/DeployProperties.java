package com.fleetdeploy.orchestrator.config;

import com.fleetdeploy.orchestrator.target.Liveness;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All orchestrator settings, bound from {@code fleetdeploy.*} in application.yml.
 *
 * Defaults here are the values used when application.yml says nothing;
 * they are also what the unit tests construct directly.
 */
@ConfigurationProperties(prefix = "fleetdeploy")
public class DeployProperties {

    /** Size of the worker pool that runs submitted deployments. */
    private int workers = 4;

    private Fleet      fleet      = new Fleet();
    private Execution  execution  = new Execution();
    private Resolution resolution = new Resolution();
    private Deploy     deploy     = new Deploy();
    private Stages     stages     = new Stages();

    public int        getWorkers()    { return workers; }
    public Fleet      getFleet()      { return fleet; }
    public Execution  getExecution()  { return execution; }
    public Resolution getResolution() { return resolution; }
    public Deploy     getDeploy()     { return deploy; }
    public Stages     getStages()     { return stages; }

    public void setWorkers(int workers)            { this.workers = workers; }
    public void setFleet(Fleet fleet)              { this.fleet = fleet; }
    public void setExecution(Execution execution)  { this.execution = execution; }
    public void setResolution(Resolution r)        { this.resolution = r; }
    public void setDeploy(Deploy deploy)           { this.deploy = deploy; }
    public void setStages(Stages stages)           { this.stages = stages; }

    // ------------------------------------------------------------------
    // Fleet inventory
    // ------------------------------------------------------------------

    public static class Fleet {
        /** "static" reads {@link #targets}; "http" queries {@link #inventoryUrl}. */
        private String source = "static";
        private String inventoryUrl = "http://localhost:9300";
        private List<StaticTarget> targets = new ArrayList<>();

        public String getSource()                 { return source; }
        public String getInventoryUrl()           { return inventoryUrl; }
        public List<StaticTarget> getTargets()    { return targets; }
        public void setSource(String source)      { this.source = source; }
        public void setInventoryUrl(String url)   { this.inventoryUrl = url; }
        public void setTargets(List<StaticTarget> targets) { this.targets = targets; }
    }

    public static class StaticTarget {
        private String id;
        private Liveness liveness = Liveness.ALIVE;
        private Map<String, String> labels = new HashMap<>();

        public String getId()                      { return id; }
        public Liveness getLiveness()              { return liveness; }
        public Map<String, String> getLabels()     { return labels; }
        public void setId(String id)               { this.id = id; }
        public void setLiveness(Liveness liveness) { this.liveness = liveness; }
        public void setLabels(Map<String, String> labels) { this.labels = labels; }
    }

    // ------------------------------------------------------------------
    // Remote execution agent
    // ------------------------------------------------------------------

    public static class Execution {
        private String agentUrl = "http://localhost:9200";
        private String token = "";
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxOutputChars = 64 * 1024;

        public String getAgentUrl()          { return agentUrl; }
        public String getToken()             { return token; }
        public Duration getPollInterval()    { return pollInterval; }
        public Duration getConnectTimeout()  { return connectTimeout; }
        public int getMaxOutputChars()       { return maxOutputChars; }
        public void setAgentUrl(String agentUrl)           { this.agentUrl = agentUrl; }
        public void setToken(String token)                 { this.token = token; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public void setConnectTimeout(Duration timeout)    { this.connectTimeout = timeout; }
        public void setMaxOutputChars(int maxOutputChars)  { this.maxOutputChars = maxOutputChars; }
    }

    // ------------------------------------------------------------------
    // Target resolution retry
    // ------------------------------------------------------------------

    public static class Resolution {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);

        public int getMaxAttempts()           { return maxAttempts; }
        public Duration getInitialBackoff()   { return initialBackoff; }
        public void setMaxAttempts(int maxAttempts)          { this.maxAttempts = maxAttempts; }
        public void setInitialBackoff(Duration backoff)      { this.initialBackoff = backoff; }
    }

    // ------------------------------------------------------------------
    // Values bound into the command templates
    // ------------------------------------------------------------------

    public static class Deploy {
        private String deployPath = "/opt/app";
        private String containerName = "app";
        private int hostPort = 80;
        private int containerPort = 8080;
        private String healthPath = "/health";
        private int probeCount = 10;
        private int probeIntervalSec = 3;

        public String getDeployPath()     { return deployPath; }
        public String getContainerName()  { return containerName; }
        public int getHostPort()          { return hostPort; }
        public int getContainerPort()     { return containerPort; }
        public String getHealthPath()     { return healthPath; }
        public int getProbeCount()        { return probeCount; }
        public int getProbeIntervalSec()  { return probeIntervalSec; }
        public void setDeployPath(String deployPath)       { this.deployPath = deployPath; }
        public void setContainerName(String name)          { this.containerName = name; }
        public void setHostPort(int hostPort)              { this.hostPort = hostPort; }
        public void setContainerPort(int containerPort)    { this.containerPort = containerPort; }
        public void setHealthPath(String healthPath)       { this.healthPath = healthPath; }
        public void setProbeCount(int probeCount)          { this.probeCount = probeCount; }
        public void setProbeIntervalSec(int seconds)       { this.probeIntervalSec = seconds; }
    }

    // ------------------------------------------------------------------
    // Per-stage settings
    // ------------------------------------------------------------------

    public static class Stages {
        private Stage dependencyCheck = new Stage("dependency-check", Duration.ofMinutes(5),  "DOCKER_READY");
        private Stage artifactPull    = new Stage("artifact-pull",    Duration.ofMinutes(10), "PULL_OK");
        private Stage deploySwap      = new Stage("deploy-swap",      Duration.ofMinutes(2),  "SWAP_OK");
        private Stage healthCheck     = new Stage("health-check",     Duration.ofMinutes(2),  "HEALTH_OK");

        public Stage getDependencyCheck() { return dependencyCheck; }
        public Stage getArtifactPull()    { return artifactPull; }
        public Stage getDeploySwap()      { return deploySwap; }
        public Stage getHealthCheck()     { return healthCheck; }
        public void setDependencyCheck(Stage s) { this.dependencyCheck = s; }
        public void setArtifactPull(Stage s)    { this.artifactPull = s; }
        public void setDeploySwap(Stage s)      { this.deploySwap = s; }
        public void setHealthCheck(Stage s)     { this.healthCheck = s; }
    }

    public static class Stage {
        private String template;
        private Duration timeout;
        /** Output line the script prints on success; blank disables the check. */
        private String expectedMarker;

        public Stage() {}

        public Stage(String template, Duration timeout, String expectedMarker) {
            this.template = template;
            this.timeout = timeout;
            this.expectedMarker = expectedMarker;
        }

        public String getTemplate()        { return template; }
        public Duration getTimeout()       { return timeout; }
        public String getExpectedMarker()  { return expectedMarker; }
        public void setTemplate(String template)             { this.template = template; }
        public void setTimeout(Duration timeout)             { this.timeout = timeout; }
        public void setExpectedMarker(String expectedMarker) { this.expectedMarker = expectedMarker; }
    }
}
