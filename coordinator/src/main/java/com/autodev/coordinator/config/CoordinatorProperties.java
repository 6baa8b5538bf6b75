package com.autodev.coordinator.config;

import com.autodev.coordinator.model.ApprovalType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables under the "autodev" prefix. Defaults match application.yml so
 * services built directly in unit tests behave like the running app.
 */
@ConfigurationProperties(prefix = "autodev")
public class CoordinatorProperties {

    private Tasks     tasks     = new Tasks();
    private Locks     locks     = new Locks();
    private Proposals proposals = new Proposals();
    private Approvals approvals = new Approvals();
    private Providers providers = new Providers();
    private Memory    memory    = new Memory();
    private Worker    worker    = new Worker();

    public Tasks     getTasks()     { return tasks; }
    public Locks     getLocks()     { return locks; }
    public Proposals getProposals() { return proposals; }
    public Approvals getApprovals() { return approvals; }
    public Providers getProviders() { return providers; }
    public Memory    getMemory()    { return memory; }
    public Worker    getWorker()    { return worker; }

    public void setTasks(Tasks tasks)             { this.tasks = tasks; }
    public void setLocks(Locks locks)             { this.locks = locks; }
    public void setProposals(Proposals proposals) { this.proposals = proposals; }
    public void setApprovals(Approvals approvals) { this.approvals = approvals; }
    public void setProviders(Providers providers) { this.providers = providers; }
    public void setMemory(Memory memory)          { this.memory = memory; }
    public void setWorker(Worker worker)          { this.worker = worker; }

    // ------------------------------------------------------------------
    // Task queue
    // ------------------------------------------------------------------

    public static class Tasks {
        // A claimed task with no heartbeat for this long is considered abandoned.
        private Duration reclaimTimeout = Duration.ofMinutes(5);
        // Reclaims allowed before a task is force-failed as poison.
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(30);
        private Duration backoffCap  = Duration.ofMinutes(10);
        private Duration sweepInterval = Duration.ofMinutes(1);

        public Duration getReclaimTimeout() { return reclaimTimeout; }
        public int      getMaxRetries()     { return maxRetries; }
        public Duration getBackoffBase()    { return backoffBase; }
        public Duration getBackoffCap()     { return backoffCap; }
        public Duration getSweepInterval()  { return sweepInterval; }

        public void setReclaimTimeout(Duration reclaimTimeout) { this.reclaimTimeout = reclaimTimeout; }
        public void setMaxRetries(int maxRetries)              { this.maxRetries = maxRetries; }
        public void setBackoffBase(Duration backoffBase)       { this.backoffBase = backoffBase; }
        public void setBackoffCap(Duration backoffCap)         { this.backoffCap = backoffCap; }
        public void setSweepInterval(Duration sweepInterval)   { this.sweepInterval = sweepInterval; }
    }

    public static class Locks {
        private Duration defaultTtl = Duration.ofMinutes(10);

        public Duration getDefaultTtl()            { return defaultTtl; }
        public void setDefaultTtl(Duration ttl)    { this.defaultTtl = ttl; }
    }

    public static class Proposals {
        private int    quorum    = 3;
        private double threshold = 0.6;

        public int    getQuorum()    { return quorum; }
        public double getThreshold() { return threshold; }

        public void setQuorum(int quorum)          { this.quorum = quorum; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
    }

    public static class Approvals {
        // Task type enqueued when an item of the given type is approved.
        private Map<ApprovalType, String> followOnTypes = defaultFollowOnTypes();
        private int followOnPriority = 8;

        private static Map<ApprovalType, String> defaultFollowOnTypes() {
            Map<ApprovalType, String> m = new EnumMap<>(ApprovalType.class);
            m.put(ApprovalType.SPEC,   "implement_feature");
            m.put(ApprovalType.MERGE,  "merge_pr");
            m.put(ApprovalType.DEPLOY, "deploy");
            return m;
        }

        public Map<ApprovalType, String> getFollowOnTypes() { return followOnTypes; }
        public int getFollowOnPriority()                    { return followOnPriority; }

        public void setFollowOnTypes(Map<ApprovalType, String> followOnTypes) { this.followOnTypes = followOnTypes; }
        public void setFollowOnPriority(int followOnPriority)                 { this.followOnPriority = followOnPriority; }
    }

    public static class Providers {
        private String  defaultProvider  = "claude";
        private String  fallbackProvider = "codex";
        private boolean autoFallback     = true;
        // Forces every worker onto one provider; blank means no override.
        private String  manualOverride;
        private Map<String, String> workerOverrides = new HashMap<>();
        // Assumed limit duration when the provider output has no parseable reset time.
        private Duration defaultLimitDuration = Duration.ofHours(1);

        public String  getDefaultProvider()               { return defaultProvider; }
        public String  getFallbackProvider()              { return fallbackProvider; }
        public boolean isAutoFallback()                   { return autoFallback; }
        public String  getManualOverride()                { return manualOverride; }
        public Map<String, String> getWorkerOverrides()   { return workerOverrides; }
        public Duration getDefaultLimitDuration()         { return defaultLimitDuration; }

        public void setDefaultProvider(String p)                   { this.defaultProvider = p; }
        public void setFallbackProvider(String p)                  { this.fallbackProvider = p; }
        public void setAutoFallback(boolean autoFallback)          { this.autoFallback = autoFallback; }
        public void setManualOverride(String manualOverride)       { this.manualOverride = manualOverride; }
        public void setWorkerOverrides(Map<String, String> m)      { this.workerOverrides = m; }
        public void setDefaultLimitDuration(Duration d)            { this.defaultLimitDuration = d; }
    }

    public static class Memory {
        // Base URL of the external semantic memory store; blank disables the hand-off.
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(10);

        public String   getBaseUrl() { return baseUrl; }
        public Duration getTimeout() { return timeout; }

        public void setBaseUrl(String baseUrl)    { this.baseUrl = baseUrl; }
        public void setTimeout(Duration timeout)  { this.timeout = timeout; }

        public boolean isEnabled() { return baseUrl != null && !baseUrl.isBlank(); }
    }

    public static class Worker {
        private boolean  enabled = false;
        private List<String> ids = new ArrayList<>();
        // Accepted task types per worker id; a worker without an entry accepts every type.
        private Map<String, List<String>> acceptedTypes = new HashMap<>();
        private Duration pollInterval      = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        // CLI invoked per task; the prompt is written to its stdin.
        private List<String> command = new ArrayList<>(List.of("claude", "--print"));
        private Duration timeout = Duration.ofMinutes(30);
        private int poolSize = 4;

        public boolean  isEnabled()                           { return enabled; }
        public List<String> getIds()                          { return ids; }
        public Map<String, List<String>> getAcceptedTypes()   { return acceptedTypes; }
        public Duration getPollInterval()                     { return pollInterval; }
        public Duration getHeartbeatInterval()                { return heartbeatInterval; }
        public List<String> getCommand()                      { return command; }
        public Duration getTimeout()                          { return timeout; }
        public int      getPoolSize()                         { return poolSize; }

        public void setEnabled(boolean enabled)                        { this.enabled = enabled; }
        public void setIds(List<String> ids)                           { this.ids = ids; }
        public void setAcceptedTypes(Map<String, List<String>> m)      { this.acceptedTypes = m; }
        public void setPollInterval(Duration pollInterval)             { this.pollInterval = pollInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval)   { this.heartbeatInterval = heartbeatInterval; }
        public void setCommand(List<String> command)                   { this.command = command; }
        public void setTimeout(Duration timeout)                       { this.timeout = timeout; }
        public void setPoolSize(int poolSize)                          { this.poolSize = poolSize; }

        public List<String> acceptedTypesFor(String workerId) {
            return acceptedTypes.getOrDefault(workerId, List.of());
        }
    }
}
