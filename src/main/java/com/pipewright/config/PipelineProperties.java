package com.pipewright.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalised configuration under the {@code pipewright} prefix.
 * <p>
 * Stage entries only need to name the values they override; anything left unset falls back to
 * the built-in policy of that stage.
 */
@Component
@ConfigurationProperties(prefix = "pipewright")
public class PipelineProperties {

    private Scheduler scheduler = new Scheduler();
    private Feedback feedback = new Feedback();
    private Orchestrator orchestrator = new Orchestrator();
    private State state = new State();
    private Map<String, Stage> stages = new LinkedHashMap<>();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Feedback getFeedback() { return feedback; }
    public void setFeedback(Feedback feedback) { this.feedback = feedback; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public Map<String, Stage> getStages() { return stages; }
    public void setStages(Map<String, Stage> stages) { this.stages = stages; }

    public static class Scheduler {
        private int maxWorkers = 10;
        private Duration productionTimeout = Duration.ofSeconds(30);

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public Duration getProductionTimeout() { return productionTimeout; }
        public void setProductionTimeout(Duration productionTimeout) { this.productionTimeout = productionTimeout; }
    }

    public static class Feedback {
        /** Loops older than this are aborted on their next failure. */
        private Duration loopCeiling = Duration.ofHours(1);
        private Retention retention = new Retention();

        public Duration getLoopCeiling() { return loopCeiling; }
        public void setLoopCeiling(Duration loopCeiling) { this.loopCeiling = loopCeiling; }
        public Retention getRetention() { return retention; }
        public void setRetention(Retention retention) { this.retention = retention; }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration maxAge = Duration.ofHours(24);
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Orchestrator {
        private int maxStageEntries = 3;

        public int getMaxStageEntries() { return maxStageEntries; }
        public void setMaxStageEntries(int maxStageEntries) { this.maxStageEntries = maxStageEntries; }
    }

    public static class State {
        /** JSON file backing the feedback store; in-memory only when unset. */
        private String file;

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    /**
     * Per-stage overrides. Boxed fields are null when not configured.
     */
    public static class Stage {
        private Integer maxAttempts;
        private Double backoffFactor;
        private Double timeoutMultiplier;
        private Integer escalationThreshold;
        private List<String> abortConditions;
        private Map<String, String> remediationHints;
        private Map<String, String> escalationTargets;
        private String defaultEscalationExecutor;
        private List<String> guidance;
        private Map<String, String> successCriteria;

        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }
        public Double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(Double backoffFactor) { this.backoffFactor = backoffFactor; }
        public Double getTimeoutMultiplier() { return timeoutMultiplier; }
        public void setTimeoutMultiplier(Double timeoutMultiplier) { this.timeoutMultiplier = timeoutMultiplier; }
        public Integer getEscalationThreshold() { return escalationThreshold; }
        public void setEscalationThreshold(Integer escalationThreshold) { this.escalationThreshold = escalationThreshold; }
        public List<String> getAbortConditions() { return abortConditions; }
        public void setAbortConditions(List<String> abortConditions) { this.abortConditions = abortConditions; }
        public Map<String, String> getRemediationHints() { return remediationHints; }
        public void setRemediationHints(Map<String, String> remediationHints) { this.remediationHints = remediationHints; }
        public Map<String, String> getEscalationTargets() { return escalationTargets; }
        public void setEscalationTargets(Map<String, String> escalationTargets) { this.escalationTargets = escalationTargets; }
        public String getDefaultEscalationExecutor() { return defaultEscalationExecutor; }
        public void setDefaultEscalationExecutor(String defaultEscalationExecutor) { this.defaultEscalationExecutor = defaultEscalationExecutor; }
        public List<String> getGuidance() { return guidance; }
        public void setGuidance(List<String> guidance) { this.guidance = guidance; }
        public Map<String, String> getSuccessCriteria() { return successCriteria; }
        public void setSuccessCriteria(Map<String, String> successCriteria) { this.successCriteria = successCriteria; }
    }
}
