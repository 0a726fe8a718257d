package com.fleetmind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "fleetmind")
public class FleetProperties {

    private String stateDir = "queue";
    private int lockTimeoutSeconds = 10;
    private String ownerId = "shogun";
    private Dispatcher dispatcher = new Dispatcher();
    private Routing routing = new Routing();
    private Ntfy ntfy = new Ntfy();
    private List<WorkerSpec> workers = new ArrayList<>();

    // -- derived paths --
    public Path stateRoot() { return Path.of(stateDir); }
    public Path inboxDir() { return stateRoot().resolve("inbox"); }
    public Path tasksDir() { return stateRoot().resolve("tasks"); }
    public Path workersDir() { return stateRoot().resolve("workers"); }
    public Duration lockTimeout() { return Duration.ofSeconds(Math.max(1, lockTimeoutSeconds)); }

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public int getLockTimeoutSeconds() { return lockTimeoutSeconds; }
    public void setLockTimeoutSeconds(int lockTimeoutSeconds) { this.lockTimeoutSeconds = lockTimeoutSeconds; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public Dispatcher getDispatcher() { return dispatcher; }
    public void setDispatcher(Dispatcher dispatcher) { this.dispatcher = dispatcher; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public Ntfy getNtfy() { return ntfy; }
    public void setNtfy(Ntfy ntfy) { this.ntfy = ntfy; }
    public List<WorkerSpec> getWorkers() { return workers; }
    public void setWorkers(List<WorkerSpec> workers) { this.workers = workers; }

    public static class Dispatcher {
        private int intervalSeconds = 5;

        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    }

    public static class Routing {
        private String configFile = "config/settings.yaml";

        public String getConfigFile() { return configFile; }
        public void setConfigFile(String configFile) { this.configFile = configFile; }
    }

    public static class Ntfy {
        private String server = "https://ntfy.sh";
        private String topic = "";
        private String ackPrefix = "📱受信: ";

        public boolean isConfigured() { return topic != null && !topic.isBlank(); }

        public String getServer() { return server; }
        public void setServer(String server) { this.server = server; }
        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public String getAckPrefix() { return ackPrefix; }
        public void setAckPrefix(String ackPrefix) { this.ackPrefix = ackPrefix; }
    }

    /** A provisioned worker: identity, starting model, CLI family and session target. */
    public static class WorkerSpec {
        private String id;
        private String model = "";
        private String cli = "claude";
        private String session = "";

        public WorkerSpec() {
        }

        public WorkerSpec(String id, String model, String cli, String session) {
            this.id = id;
            this.model = model;
            this.cli = cli;
            this.session = session;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getCli() { return cli; }
        public void setCli(String cli) { this.cli = cli; }
        public String getSession() { return session; }
        public void setSession(String session) { this.session = session; }
    }
}
