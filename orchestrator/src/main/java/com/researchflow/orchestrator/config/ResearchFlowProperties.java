package com.researchflow.orchestrator.config;

import com.researchflow.orchestrator.model.FailurePolicy;
import com.researchflow.orchestrator.model.GovernanceMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code researchflow.*} configuration tree.
 * <p>
 * Covers:
 * <ul>
 *     <li>governance defaults and submission validation</li>
 *     <li>worker pool, job retry and stall recovery</li>
 *     <li>dispatch timeout and circuit breaker tuning</li>
 *     <li>progress event log limits</li>
 *     <li>PHI gate selection</li>
 *     <li>the agent endpoint table and the stage catalog</li>
 * </ul>
 * Cross-references between the agent table and the catalog are checked by
 * {@code StageCatalog} and {@code AgentRegistry} when they are constructed.
 */
@Validated
@ConfigurationProperties(prefix = "researchflow")
public class ResearchFlowProperties {

    @Valid private final Governance governance = new Governance();
    @Valid private final Submission submission = new Submission();
    @Valid private final Worker     worker     = new Worker();
    @Valid private final Dispatch   dispatch   = new Dispatch();
    @Valid private final Breaker    breaker    = new Breaker();
    @Valid private final Events     events     = new Events();
    @Valid private final Phi        phi        = new Phi();
    @Valid private final Health     health     = new Health();

    /** Agent endpoints keyed by endpoint id. */
    @Valid
    private Map<String, Agent> agents = new LinkedHashMap<>();

    /** Stage definitions keyed by stage number. */
    @Valid
    private Map<Integer, Stage> stages = new LinkedHashMap<>();

    public Governance getGovernance() { return governance; }
    public Submission getSubmission() { return submission; }
    public Worker     getWorker()     { return worker; }
    public Dispatch   getDispatch()   { return dispatch; }
    public Breaker    getBreaker()    { return breaker; }
    public Events     getEvents()     { return events; }
    public Phi        getPhi()        { return phi; }
    public Health     getHealth()     { return health; }

    public Map<String, Agent>  getAgents()                    { return agents; }
    public void                setAgents(Map<String, Agent> a) { this.agents = a; }
    public Map<Integer, Stage> getStages()                     { return stages; }
    public void                setStages(Map<Integer, Stage> s) { this.stages = s; }

    // ------------------------------------------------------------------
    // Governance / submission
    // ------------------------------------------------------------------

    public static class Governance {
        /** Mode applied when a submission does not name one. */
        @NotNull
        private GovernanceMode defaultMode = GovernanceMode.LIVE;

        public GovernanceMode getDefaultMode()                  { return defaultMode; }
        public void           setDefaultMode(GovernanceMode m)  { this.defaultMode = m; }
    }

    public static class Submission {
        @NotBlank
        private String workflowIdPattern = "^[A-Za-z0-9][A-Za-z0-9_-]{2,63}$";

        public String getWorkflowIdPattern()           { return workflowIdPattern; }
        public void   setWorkflowIdPattern(String p)   { this.workflowIdPattern = p; }
    }

    // ------------------------------------------------------------------
    // Worker pool
    // ------------------------------------------------------------------

    public static class Worker {
        /** Jobs executing concurrently in this process. */
        @Min(1)
        private int concurrency = 2;

        /** Delay between queue polls; read by the scheduler annotation. */
        @Min(10)
        private long pollIntervalMs = 500;

        @Min(1)
        private int maxAttempts = 3;

        /** First retry delay; doubled on every further attempt. */
        @NotNull
        private Duration backoffBase = Duration.ofSeconds(5);

        @NotNull
        private Duration stallTimeout = Duration.ofMinutes(5);

        @Min(1000)
        private long stallCheckIntervalMs = 60_000;

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int      getConcurrency()          { return concurrency; }
        public long     getPollIntervalMs()       { return pollIntervalMs; }
        public int      getMaxAttempts()          { return maxAttempts; }
        public Duration getBackoffBase()          { return backoffBase; }
        public Duration getStallTimeout()         { return stallTimeout; }
        public long     getStallCheckIntervalMs() { return stallCheckIntervalMs; }
        public Duration getShutdownTimeout()      { return shutdownTimeout; }

        public void setConcurrency(int v)             { this.concurrency = v; }
        public void setPollIntervalMs(long v)         { this.pollIntervalMs = v; }
        public void setMaxAttempts(int v)             { this.maxAttempts = v; }
        public void setBackoffBase(Duration v)        { this.backoffBase = v; }
        public void setStallTimeout(Duration v)       { this.stallTimeout = v; }
        public void setStallCheckIntervalMs(long v)   { this.stallCheckIntervalMs = v; }
        public void setShutdownTimeout(Duration v)    { this.shutdownTimeout = v; }
    }

    // ------------------------------------------------------------------
    // Dispatch and circuit breaker
    // ------------------------------------------------------------------

    public static class Dispatch {
        /** Upper bound on one agent call, local or remote. */
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Duration getCallTimeout()               { return callTimeout; }
        public Duration getConnectTimeout()            { return connectTimeout; }
        public void     setCallTimeout(Duration v)     { this.callTimeout = v; }
        public void     setConnectTimeout(Duration v)  { this.connectTimeout = v; }
    }

    public static class Breaker {
        @Min(1)
        private int failureThreshold = 5;

        /** Failures further apart than this do not accumulate. */
        @NotNull
        private Duration failureWindow = Duration.ofSeconds(60);

        @NotNull
        private Duration cooldown = Duration.ofSeconds(30);

        @DecimalMin("1.0")
        private double cooldownMultiplier = 2.0;

        @NotNull
        private Duration maxCooldown = Duration.ofMinutes(5);

        public int      getFailureThreshold()   { return failureThreshold; }
        public Duration getFailureWindow()      { return failureWindow; }
        public Duration getCooldown()           { return cooldown; }
        public double   getCooldownMultiplier() { return cooldownMultiplier; }
        public Duration getMaxCooldown()        { return maxCooldown; }

        public void setFailureThreshold(int v)       { this.failureThreshold = v; }
        public void setFailureWindow(Duration v)     { this.failureWindow = v; }
        public void setCooldown(Duration v)          { this.cooldown = v; }
        public void setCooldownMultiplier(double v)  { this.cooldownMultiplier = v; }
        public void setMaxCooldown(Duration v)       { this.maxCooldown = v; }
    }

    // ------------------------------------------------------------------
    // Progress events
    // ------------------------------------------------------------------

    public static class Events {
        @Min(1)
        private int maxEventsPerJob = 1000;

        /** How long a finished job's log stays readable. */
        @NotNull
        private Duration retention = Duration.ofMinutes(5);

        /**
         * How long a log with no terminal event and no subscriber is kept
         * after its last activity. Keep it above the worker stall timeout.
         */
        @NotNull
        private Duration idleRetention = Duration.ofMinutes(30);

        @Min(1000)
        private long sweepIntervalMs = 30_000;

        /** How often jobs with open streams but no terminal event are checked against the jobs table. */
        @Min(100)
        private long reconcileIntervalMs = 5_000;

        @NotNull
        private Duration sseTimeout = Duration.ofMinutes(30);

        public int      getMaxEventsPerJob()     { return maxEventsPerJob; }
        public Duration getRetention()           { return retention; }
        public Duration getIdleRetention()       { return idleRetention; }
        public long     getSweepIntervalMs()     { return sweepIntervalMs; }
        public long     getReconcileIntervalMs() { return reconcileIntervalMs; }
        public Duration getSseTimeout()          { return sseTimeout; }

        public void setMaxEventsPerJob(int v)      { this.maxEventsPerJob = v; }
        public void setRetention(Duration v)       { this.retention = v; }
        public void setIdleRetention(Duration v)   { this.idleRetention = v; }
        public void setSweepIntervalMs(long v)     { this.sweepIntervalMs = v; }
        public void setReconcileIntervalMs(long v) { this.reconcileIntervalMs = v; }
        public void setSseTimeout(Duration v)      { this.sseTimeout = v; }
    }

    // ------------------------------------------------------------------
    // PHI gate / health probing
    // ------------------------------------------------------------------

    public static class Phi {
        /** Base URL of an external scan service; blank selects the in-process scanner. */
        private String scannerUrl = "";

        @NotNull
        private Duration scanTimeout = Duration.ofSeconds(5);

        /** Additional regular expressions flagged as {@code CUSTOM}. */
        private List<String> extraPatterns = new ArrayList<>();

        public String       getScannerUrl()    { return scannerUrl; }
        public Duration     getScanTimeout()   { return scanTimeout; }
        public List<String> getExtraPatterns() { return extraPatterns; }

        public void setScannerUrl(String v)          { this.scannerUrl = v; }
        public void setScanTimeout(Duration v)       { this.scanTimeout = v; }
        public void setExtraPatterns(List<String> v) { this.extraPatterns = v; }
    }

    public static class Health {
        @Min(1000)
        private long checkIntervalMs = 30_000;

        @NotNull
        private Duration checkTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int checkThreads = 4;

        public long     getCheckIntervalMs()            { return checkIntervalMs; }
        public Duration getCheckTimeout()               { return checkTimeout; }
        public int      getCheckThreads()               { return checkThreads; }
        public void     setCheckIntervalMs(long v)      { this.checkIntervalMs = v; }
        public void     setCheckTimeout(Duration v)     { this.checkTimeout = v; }
        public void     setCheckThreads(int v)          { this.checkThreads = v; }
    }

    // ------------------------------------------------------------------
    // Agent endpoint table
    // ------------------------------------------------------------------

    public static class Agent {
        /** {@code http(s)://host:port} for a remote proxy, {@code local:<name>} for an in-process agent. */
        @NotBlank
        private String address;

        @NotEmpty
        private List<String> taskTypes = new ArrayList<>();

        public String       getAddress()                  { return address; }
        public List<String> getTaskTypes()                { return taskTypes; }
        public void         setAddress(String v)          { this.address = v; }
        public void         setTaskTypes(List<String> v)  { this.taskTypes = v; }
    }

    // ------------------------------------------------------------------
    // Stage catalog
    // ------------------------------------------------------------------

    public static class Stage {
        @NotBlank
        private String name;

        @Valid
        private List<RequiredField> requiredFields = new ArrayList<>();

        @Valid
        @NotEmpty
        private List<StepSpec> steps = new ArrayList<>();

        public String             getName()           { return name; }
        public List<RequiredField> getRequiredFields() { return requiredFields; }
        public List<StepSpec>     getSteps()          { return steps; }

        public void setName(String v)                          { this.name = v; }
        public void setRequiredFields(List<RequiredField> v)   { this.requiredFields = v; }
        public void setSteps(List<StepSpec> v)                 { this.steps = v; }
    }

    public static class RequiredField {
        @NotBlank
        private String name;

        @Min(1)
        private int minLength = 1;

        public String getName()            { return name; }
        public int    getMinLength()       { return minLength; }
        public void   setName(String v)    { this.name = v; }
        public void   setMinLength(int v)  { this.minLength = v; }
    }

    public static class StepSpec {
        @NotBlank
        private String name;

        @NotBlank
        private String taskType;

        @NotNull
        private FailurePolicy demo = FailurePolicy.STRICT;

        @NotNull
        private FailurePolicy live = FailurePolicy.STRICT;

        public String        getName()      { return name; }
        public String        getTaskType()  { return taskType; }
        public FailurePolicy getDemo()      { return demo; }
        public FailurePolicy getLive()      { return live; }

        public void setName(String v)            { this.name = v; }
        public void setTaskType(String v)        { this.taskType = v; }
        public void setDemo(FailurePolicy v)     { this.demo = v; }
        public void setLive(FailurePolicy v)     { this.live = v; }
    }
}
