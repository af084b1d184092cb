package com.pipewright.core.orchestrator;

import com.pipewright.config.PipelineProperties;
import com.pipewright.core.ConfigurationException;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.feedback.ArtifactProducer;
import com.pipewright.core.feedback.FeedbackDecisionEngine;
import com.pipewright.core.logging.MdcContext;
import com.pipewright.core.metrics.PipelineMetrics;
import com.pipewright.core.model.FailureOrigin;
import com.pipewright.core.model.FailureRecord;
import com.pipewright.core.model.FeedbackDecision;
import com.pipewright.core.model.PipelineRun;
import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.ValidationResult;
import com.pipewright.core.model.WorkOrder;
import com.pipewright.core.model.WorkOrderStatus;
import com.pipewright.core.scheduler.DependencyGraph;
import com.pipewright.core.scheduler.PipelineScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the stages of a pipeline one at a time in dependency order and applies feedback
 * decisions to them.
 * <p>
 * Per stage entry the work orders are dispatched through the {@link PipelineScheduler}, the
 * reported validation result is obtained from the request's {@link StageValidator}, and every
 * work order's feedback loop is evaluated by the {@link FeedbackDecisionEngine}. Retried and
 * escalated work orders are reissued with the remediation instruction. A verification failure
 * blamed on the produced artifact suspends the verifying stage, re-enters the producing stage
 * with the remediation, and then verifies again. A stage is entered at most
 * {@code pipewright.orchestrator.max-stage-entries} times per run, reroute re-entries included.
 */
@Service
public class StageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    static final String PRODUCTION_FAILURE = "instruction_production_error";

    private final PipelineScheduler scheduler;
    private final FeedbackDecisionEngine engine;
    private final int maxStageEntries;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final Clock clock;

    @Autowired
    public StageOrchestrator(PipelineScheduler scheduler, FeedbackDecisionEngine engine,
                             PipelineProperties properties, EventBus eventBus, PipelineMetrics metrics) {
        this(scheduler, engine, properties.getOrchestrator().getMaxStageEntries(), eventBus, metrics,
                Clock.systemUTC());
    }

    public StageOrchestrator(PipelineScheduler scheduler, FeedbackDecisionEngine engine, int maxStageEntries,
                             EventBus eventBus, PipelineMetrics metrics) {
        this(scheduler, engine, maxStageEntries, eventBus, metrics, Clock.systemUTC());
    }

    public StageOrchestrator(PipelineScheduler scheduler, FeedbackDecisionEngine engine, int maxStageEntries,
                             EventBus eventBus, PipelineMetrics metrics, Clock clock) {
        this.scheduler = scheduler;
        this.engine = engine;
        this.maxStageEntries = maxStageEntries;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Executes a pipeline. The first stage that fails ends the run; later stages stay PENDING.
     *
     * @throws ConfigurationException if the request is invalid; nothing is dispatched then
     */
    public RunResult execute(PipelineRequest request) {
        List<StageDefinition> ordered = validate(request);
        String runId = request.runId() != null ? request.runId() : generateRunId();
        long startMs = clock.millis();
        var execution = new Execution(runId, request, ordered);

        MdcContext.setRun(runId);
        EventBus.Subscription feedbackEvents = eventBus.subscribe(runId, "feedback.", execution.feedbackEvents::add);
        try {
            log.info("Starting run {} with stages {}", runId, ordered.stream().map(StageDefinition::name).toList());
            publish(runId, "run.started", null, Map.of("stages", ordered.size()));

            for (StageDefinition stage : ordered) {
                if (!dependenciesCompleted(execution, stage)) {
                    log.info("Stage {} left pending: dependencies not completed", stage.name());
                    break;
                }
                if (runStage(execution, stage, stage.workOrders()) == StageStatus.FAILED) {
                    break;
                }
            }

            RunResult result = buildResult(execution, clock.millis() - startMs);
            log.info("Run {} finished {} in {}ms (failed stages: {})",
                    runId, result.status(), result.elapsedMs(), result.failedStages());
            if (metrics != null) {
                metrics.recordRunResult(result.status().name());
            }
            publish(runId, result.succeeded() ? "run.completed" : "run.failed", null,
                    Map.of("failedStages", result.failedStages()));
            return result;
        } finally {
            feedbackEvents.unsubscribe();
            MdcContext.clear();
        }
    }

    /**
     * Checks policies, references and the stage graph.
     *
     * @return the stages in the order they run
     */
    List<StageDefinition> validate(PipelineRequest request) {
        if (request.validator() == null) {
            throw new ConfigurationException("A pipeline request needs a stage validator");
        }
        var names = request.stages().stream().map(StageDefinition::name).toList();
        for (StageDefinition stage : request.stages()) {
            if (!engine.hasPolicy(stage.name())) {
                throw new ConfigurationException("No feedback policy configured for stage '" + stage.name() + "'");
            }
            if (stage.producerStage() != null) {
                if (!names.contains(stage.producerStage())) {
                    throw new ConfigurationException("Stage '" + stage.name()
                            + "' verifies unknown stage '" + stage.producerStage() + "'");
                }
                if (stage.producerStage().equals(stage.name())) {
                    throw new ConfigurationException("Stage '" + stage.name() + "' cannot verify itself");
                }
            }
        }
        return DependencyGraph.of(request.stages(), StageDefinition::name, StageDefinition::dependsOn, "stage")
                .topologicalSort();
    }

    private StageStatus runStage(Execution execution, StageDefinition stage, List<WorkOrder> toDispatch) {
        StageState state = execution.state(stage.name());
        List<WorkOrder> pending = toDispatch;

        while (true) {
            MdcContext.setStage(execution.runId, stage.name());
            if (state.entries >= maxStageEntries) {
                state.status = StageStatus.FAILED;
                state.terminal = false;
                log.warn("Stage {} reached the limit of {} entries with {} unresolved work orders",
                        stage.name(), maxStageEntries, state.unresolved.size());
                publish(execution.runId, "stage.failed", stage.name(),
                        Map.of("reason", "entry limit reached", "entries", state.entries));
                return state.status;
            }
            state.entries++;
            state.status = StageStatus.RUNNING;
            log.info("Entering stage {} ({} of {}) with {} work orders",
                    stage.name(), state.entries, maxStageEntries, pending.size());
            publish(execution.runId, "stage.started", stage.name(), Map.of("entry", state.entries));

            long startMs = clock.millis();
            PipelineRun run = scheduler.dispatch(stage.mode(), withoutSettledDependencies(state, pending));
            run.workOrders().forEach(w ->
                    state.latest.put(w.taskId(), w.withDependencies(state.original(w.taskId()).dependencies())));
            ValidationResult validation = withProductionFailures(
                    execution.request.validator().validate(stage, run), run);
            state.validation = validation;
            if (metrics != null) {
                metrics.recordStageDuration(stage.name(), clock.millis() - startMs);
            }

            var next = new ArrayList<WorkOrder>();
            var reroutes = new ArrayList<Reroute>();
            var routed = new HashMap<RerouteKey, Reroute>();
            boolean aborted = false;

            for (WorkOrder workOrder : run.workOrders()) {
                if (workOrder.status() == WorkOrderStatus.PENDING) {
                    next.add(workOrder);
                    continue;
                }
                String taskId = workOrder.taskId();
                String loopId = engine.register(execution.runId, stage.name(), workOrder.executorId(), taskId,
                        state.original(taskId).instructionText());
                state.loopIds.put(taskId, loopId);

                ValidationResult own = validationFor(validation, workOrder);
                Optional<Reroute> reroute = own.success()
                        ? Optional.empty()
                        : tryReroute(execution, stage, loopId, own, workOrder, routed);
                FeedbackDecision decision = reroute.isPresent()
                        ? reroute.get().rollback()
                        : engine.evaluate(loopId, own, null);
                state.decisions.add(decision);
                reroute.ifPresent(reroutes::add);

                if (decision instanceof FeedbackDecision.Continue) {
                    state.unresolved.remove(taskId);
                } else if (decision instanceof FeedbackDecision.Abort abort) {
                    aborted = true;
                    state.unresolved.remove(taskId);
                    state.abortReasons.add(stage.name() + "/" + taskId + ": " + abort.reasoning());
                } else if (decision instanceof FeedbackDecision.Remediation remediation) {
                    state.unresolved.put(taskId, decision);
                    if (remediation instanceof FeedbackDecision.Escalate escalate) {
                        state.loopIds.put(taskId, escalate.successorLoopId());
                    }
                    next.add(workOrder.reissue(remediation.targetExecutor(), remediation.instruction()));
                } else if (decision instanceof FeedbackDecision.Rollback rollback) {
                    if (rollback.remediation() instanceof FeedbackDecision.Abort abort) {
                        aborted = true;
                        String reason = rollback.targetStage() + "/" + reroute.get().producerTaskId()
                                + ": " + abort.reasoning();
                        if (!state.abortReasons.contains(reason)) {
                            state.abortReasons.add(reason);
                        }
                    } else {
                        state.unresolved.put(taskId, decision);
                    }
                }
            }

            if (aborted) {
                state.status = StageStatus.FAILED;
                state.terminal = true;
                log.warn("Stage {} failed: feedback loop aborted", stage.name());
                publish(execution.runId, "stage.failed", stage.name(), Map.of("reason", "aborted"));
                return state.status;
            }
            if (next.isEmpty() && reroutes.isEmpty()) {
                state.status = StageStatus.COMPLETED;
                state.unresolved.clear();
                log.info("Stage {} completed after {} entries", stage.name(), state.entries);
                publish(execution.runId, "stage.completed", stage.name(), Map.of("entries", state.entries));
                return state.status;
            }

            if (!reroutes.isEmpty()) {
                StageStatus producerOutcome = resolveReroutes(execution, stage, reroutes);
                if (producerOutcome == StageStatus.FAILED) {
                    StageState producer = execution.state(stage.producerStage());
                    state.status = StageStatus.FAILED;
                    state.terminal = producer.terminal;
                    publish(execution.runId, "stage.failed", stage.name(),
                            Map.of("reason", "producer stage " + stage.producerStage() + " failed"));
                    return state.status;
                }
                for (Reroute r : reroutes) {
                    WorkOrder verifier = state.latest.get(r.verifierTaskId());
                    next.add(verifier.reissue(null, state.original(r.verifierTaskId()).instructionText()));
                }
            }

            next.sort(Comparator.comparingInt(w -> state.declarationIndex(w.taskId())));
            pending = next;
        }
    }

    /**
     * Suspends the verifying stage and re-enters the producing stage with the rerouted
     * remediation instructions.
     */
    private StageStatus resolveReroutes(Execution execution, StageDefinition verifier, List<Reroute> reroutes) {
        StageState verifierState = execution.state(verifier.name());
        verifierState.status = StageStatus.SUSPENDED;
        publish(execution.runId, "stage.suspended", verifier.name(),
                Map.of("producerStage", verifier.producerStage(), "reroutes", reroutes.size()));

        StageDefinition producer = execution.definition(verifier.producerStage());
        StageState producerState = execution.state(producer.name());
        var reissued = new LinkedHashMap<String, WorkOrder>();
        // distinct defects against one producer work order: the last decision is the loop's current one
        for (Reroute r : reroutes) {
            WorkOrder latest = producerState.latest.get(r.producerTaskId());
            String executor = r.rollback().remediation() instanceof FeedbackDecision.Remediation remediation
                    ? remediation.targetExecutor()
                    : latest.executorId();
            reissued.put(r.producerTaskId(), latest.reissue(executor, r.rollback().instruction()));
        }
        log.info("Stage {} suspended; re-entering {} for {}", verifier.name(), producer.name(), reissued.keySet());
        StageStatus outcome = runStage(execution, producer, List.copyOf(reissued.values()));
        MdcContext.setStage(execution.runId, verifier.name());
        return outcome;
    }

    /**
     * Routes an artifact defect found by a verifier work order to the producing work order. Within
     * one stage entry the same defect against the same producer work order is charged once; further
     * verifier work orders reporting it share the first rollback.
     */
    private Optional<Reroute> tryReroute(Execution execution, StageDefinition stage, String loopId,
                                         ValidationResult own, WorkOrder workOrder,
                                         Map<RerouteKey, Reroute> routed) {
        if (stage.kind() != StageKind.VERIFICATION || stage.producerStage() == null) {
            return Optional.empty();
        }
        Optional<FailureRecord> defect = own.failures().stream()
                .filter(f -> engine.classifyVerificationFailure(f) == FailureOrigin.ARTIFACT_DEFECT)
                .findFirst();
        if (defect.isEmpty()) {
            return Optional.empty();
        }
        StageState producerState = execution.state(stage.producerStage());
        Optional<String> producerTaskId = producingWorkOrder(producerState, workOrder, defect.get());
        if (producerTaskId.isEmpty()) {
            log.warn("Artifact defect reported by {} but no producing work order in {} could be identified; "
                    + "keeping the failure with the verifier", workOrder.taskId(), stage.producerStage());
            return Optional.empty();
        }
        String taskId = producerTaskId.get();
        var key = new RerouteKey(taskId, defect.get());
        Reroute first = routed.get(key);
        if (first != null) {
            log.debug("Defect reported by {} was already routed to {} by {}",
                    workOrder.taskId(), taskId, first.verifierTaskId());
            FeedbackDecision.Rollback shared = first.rollback();
            return Optional.of(new Reroute(new FeedbackDecision.Rollback(loopId, shared.targetStage(),
                    shared.redirectedLoopId(), shared.remediation(), shared.instruction(), shared.reasoning()),
                    workOrder.taskId(), taskId));
        }
        var producer = new ArtifactProducer(stage.producerStage(), producerState.latest.get(taskId).executorId(),
                taskId, producerState.original(taskId).instructionText());
        var rollback = engine.routeVerificationFailure(loopId, own, defect.get(), producer);
        var reroute = new Reroute(rollback, workOrder.taskId(), taskId);
        routed.put(key, reroute);
        return Optional.of(reroute);
    }

    /**
     * Drops dependencies on work orders of the same stage that are not being dispatched again.
     * Those completed on an earlier entry.
     */
    private static List<WorkOrder> withoutSettledDependencies(StageState state, List<WorkOrder> pending) {
        Set<String> dispatching = pending.stream().map(WorkOrder::taskId).collect(Collectors.toSet());
        return pending.stream()
                .map(w -> {
                    Set<String> kept = w.dependencies().stream()
                            .filter(dep -> dispatching.contains(dep) || !state.originals.containsKey(dep))
                            .collect(Collectors.toCollection(LinkedHashSet::new));
                    return kept.size() == w.dependencies().size() ? w : w.withDependencies(kept);
                })
                .toList();
    }

    /**
     * The producer work order behind a verifier work order: named in the failure details, else
     * the first producer work order the verifier depends on, else the producer's only work order.
     */
    private Optional<String> producingWorkOrder(StageState producer, WorkOrder verifier, FailureRecord failure) {
        Object named = failure.details().get("producerWorkOrderId");
        if (named != null && producer.latest.containsKey(named.toString())) {
            return Optional.of(named.toString());
        }
        for (String taskId : producer.latest.keySet()) {
            if (verifier.dependencies().contains(taskId)) {
                return Optional.of(taskId);
            }
        }
        if (producer.latest.size() == 1) {
            return Optional.of(producer.latest.keySet().iterator().next());
        }
        return Optional.empty();
    }

    private static ValidationResult withProductionFailures(ValidationResult validation, PipelineRun run) {
        var extra = run.failedWorkOrders().stream()
                .map(w -> FailureRecord.forWorkOrder(w.taskId(), PRODUCTION_FAILURE, w.error()))
                .toList();
        return validation.withAdditionalFailures(extra);
    }

    /**
     * The part of a stage validation that concerns one work order. Failures without a work
     * order id apply to every work order.
     */
    private static ValidationResult validationFor(ValidationResult validation, WorkOrder workOrder) {
        List<FailureRecord> failures = validation.failuresFor(workOrder.taskId());
        if (!failures.isEmpty()) {
            return new ValidationResult(false, failures, validation.qualityGates(), validation.details());
        }
        if (!validation.success() && validation.failures().isEmpty()) {
            return ValidationResult.failed(FailureRecord.forWorkOrder(workOrder.taskId(), "validation_failed",
                    "Validation failed without details"));
        }
        return ValidationResult.passed();
    }

    private static boolean dependenciesCompleted(Execution execution, StageDefinition stage) {
        return stage.dependsOn().stream()
                .allMatch(dep -> execution.state(dep).status == StageStatus.COMPLETED);
    }

    private RunResult buildResult(Execution execution, long elapsedMs) {
        var stages = new LinkedHashMap<String, StageResult>();
        var failed = new ArrayList<String>();
        var remediation = new ArrayList<String>();
        for (StageDefinition definition : execution.ordered) {
            StageState state = execution.state(definition.name());
            int retries = (int) state.decisions.stream()
                    .filter(d -> d instanceof FeedbackDecision.Remediation)
                    .count();
            stages.put(definition.name(), new StageResult(definition.name(), state.status,
                    List.copyOf(state.latest.values()), state.validation, List.copyOf(state.loopIds.values()),
                    retries, state.entries, state.decisions, state.terminal));
            if (state.status == StageStatus.FAILED) {
                failed.add(definition.name());
                for (FeedbackDecision open : state.unresolved.values()) {
                    String directive = engine.renderDirective(open);
                    if (!directive.isBlank()) {
                        remediation.add(directive);
                    }
                }
                remediation.addAll(state.abortReasons);
            }
        }
        boolean completed = failed.isEmpty()
                && stages.values().stream().allMatch(s -> s.status() == StageStatus.COMPLETED);
        return new RunResult(execution.runId, completed ? RunStatus.COMPLETED : RunStatus.FAILED, stages,
                failed, remediation, !completed, engine.feedbackStatus(execution.runId),
                List.copyOf(execution.feedbackEvents), elapsedMs);
    }

    private void publish(String runId, String type, String subject, Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(type, runId, subject, payload, clock.instant()));
    }

    /**
     * Generates a run id in the format PIPE-YYYY-NNNN.
     */
    private String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("PIPE-%d-%04d", year, count);
    }

    private record Reroute(FeedbackDecision.Rollback rollback, String verifierTaskId, String producerTaskId) {}

    private record RerouteKey(String producerTaskId, FailureRecord defect) {}

    /** Mutable bookkeeping of one run. */
    private static final class Execution {
        final String runId;
        final PipelineRequest request;
        final List<StageDefinition> ordered;
        final Map<String, StageState> states = new LinkedHashMap<>();
        final List<PipelineEvent> feedbackEvents = new CopyOnWriteArrayList<>();

        Execution(String runId, PipelineRequest request, List<StageDefinition> ordered) {
            this.runId = runId;
            this.request = request;
            this.ordered = ordered;
            ordered.forEach(stage -> states.put(stage.name(), new StageState(stage)));
        }

        StageState state(String stage) {
            return states.get(stage);
        }

        StageDefinition definition(String stage) {
            return states.get(stage).definition;
        }
    }

    private static final class StageState {
        final StageDefinition definition;
        final Map<String, WorkOrder> originals = new LinkedHashMap<>();
        final Map<String, WorkOrder> latest = new LinkedHashMap<>();
        final Map<String, String> loopIds = new LinkedHashMap<>();
        final Map<String, FeedbackDecision> unresolved = new LinkedHashMap<>();
        final List<FeedbackDecision> decisions = new ArrayList<>();
        final List<String> abortReasons = new ArrayList<>();
        StageStatus status = StageStatus.PENDING;
        ValidationResult validation;
        int entries;
        boolean terminal;

        StageState(StageDefinition definition) {
            this.definition = definition;
            definition.workOrders().forEach(w -> {
                originals.put(w.taskId(), w);
                latest.put(w.taskId(), w);
            });
        }

        WorkOrder original(String taskId) {
            return originals.get(taskId);
        }

        int declarationIndex(String taskId) {
            return new ArrayList<>(originals.keySet()).indexOf(taskId);
        }
    }
}
