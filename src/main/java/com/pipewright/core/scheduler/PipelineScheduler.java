package com.pipewright.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.config.PipelineProperties;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.logging.MdcContext;
import com.pipewright.core.metrics.PipelineMetrics;
import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.PipelineRun;
import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.WorkOrder;
import com.pipewright.core.model.WorkOrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a list of work orders into produced instructions and one instruction batch.
 * <p>
 * Parallel dispatch produces instructions on a bounded pool and re-indexes the outcomes to the
 * submission order. Sequential dispatch hands each work order the previous one's result and
 * stops at the first failure. Dependency-graph dispatch sorts first, then runs sequentially.
 */
@Service
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);
    private static final AtomicInteger BATCH_COUNTER = new AtomicInteger(0);

    private final InstructionProducer producer;
    private final int maxWorkers;
    private final Duration productionTimeout;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final Clock clock;

    @Autowired
    public PipelineScheduler(PipelineProperties properties, ObjectMapper objectMapper,
                             EventBus eventBus, PipelineMetrics metrics) {
        this(InstructionBuilder::build, properties.getScheduler().getMaxWorkers(),
                properties.getScheduler().getProductionTimeout(), objectMapper, eventBus, metrics,
                Clock.systemUTC());
    }

    PipelineScheduler(InstructionProducer producer, int maxWorkers, Duration productionTimeout) {
        this(producer, maxWorkers, productionTimeout, new ObjectMapper().findAndRegisterModules(),
                new EventBus(), null, Clock.systemUTC());
    }

    public PipelineScheduler(InstructionProducer producer, int maxWorkers, Duration productionTimeout,
                             ObjectMapper objectMapper, EventBus eventBus, PipelineMetrics metrics,
                             Clock clock) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        this.producer = producer;
        this.maxWorkers = maxWorkers;
        this.productionTimeout = productionTimeout;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public PipelineRun dispatch(DispatchMode mode, List<WorkOrder> workOrders) {
        return switch (mode) {
            case PARALLEL -> dispatchParallel(workOrders);
            case SEQUENTIAL -> dispatchSequential(workOrders);
            case DEPENDENCY_GRAPH -> dispatchDependencyGraph(workOrders);
        };
    }

    /**
     * Produces every instruction concurrently. A failing work order is marked FAILED on its own;
     * the others are unaffected.
     */
    public PipelineRun dispatchParallel(List<WorkOrder> workOrders) {
        String runId = nextRunId();
        long startMs = System.currentTimeMillis();
        if (workOrders.isEmpty()) {
            return finish(runId, DispatchMode.PARALLEL, List.of(), startMs);
        }

        int poolSize = Math.min(workOrders.size(), maxWorkers);
        log.info("Dispatching {} work orders in parallel on {} workers (run {})",
                workOrders.size(), poolSize, runId);

        var counter = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "pipewright-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var dispatched = new ArrayList<WorkOrder>(workOrders.size());
            var futures = new ArrayList<Future<WorkOrder>>(workOrders.size());
            for (WorkOrder workOrder : workOrders) {
                WorkOrder started = workOrder.dispatched(clock.instant());
                dispatched.add(started);
                futures.add(pool.submit(() -> {
                    try {
                        return produce(runId, started, null);
                    } finally {
                        MdcContext.clear();
                    }
                }));
            }

            // single join barrier; outcomes stay at their submission index
            var outcomes = new ArrayList<WorkOrder>(workOrders.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), dispatched.get(i)));
            }
            return finish(runId, DispatchMode.PARALLEL, outcomes, startMs);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Produces instructions one at a time in declared order. Each instruction carries the previous
     * work order's result. Work orders after the first failure are left PENDING.
     */
    public PipelineRun dispatchSequential(List<WorkOrder> workOrders) {
        return runSequentially(nextRunId(), DispatchMode.SEQUENTIAL, workOrders);
    }

    /**
     * Sorts the work orders topologically, then dispatches them sequentially.
     *
     * @throws com.pipewright.core.ConfigurationException on cycles or unknown dependencies,
     *         before any work order is touched
     */
    public PipelineRun dispatchDependencyGraph(List<WorkOrder> workOrders) {
        List<WorkOrder> ordered = DependencyGraph
                .of(workOrders, WorkOrder::taskId, WorkOrder::dependencies, "task")
                .topologicalSort();
        log.debug("Dependency order: {}", ordered.stream().map(WorkOrder::taskId).toList());
        return runSequentially(nextRunId(), DispatchMode.DEPENDENCY_GRAPH, ordered);
    }

    private PipelineRun runSequentially(String runId, DispatchMode mode, List<WorkOrder> workOrders) {
        long startMs = System.currentTimeMillis();
        log.info("Dispatching {} work orders sequentially (run {}, mode {})", workOrders.size(), runId, mode);

        var outcomes = new ArrayList<WorkOrder>(workOrders.size());
        String previousResult = null;
        int index = 0;
        for (; index < workOrders.size(); index++) {
            WorkOrder outcome;
            try {
                outcome = produce(runId, workOrders.get(index).dispatched(clock.instant()), previousResult);
            } finally {
                MdcContext.clearWorkOrder();
            }
            outcomes.add(outcome);
            if (outcome.status() == WorkOrderStatus.FAILED) {
                log.warn("Work order {} failed, {} remaining work orders left pending",
                        outcome.taskId(), workOrders.size() - index - 1);
                index++;
                break;
            }
            previousResult = carryOver(outcome);
        }
        outcomes.addAll(workOrders.subList(index, workOrders.size()));
        return finish(runId, mode, outcomes, startMs);
    }

    private WorkOrder produce(String runId, WorkOrder started, String previousResult) {
        MdcContext.setWorkOrder(runId, started.taskId(), started.executorId());
        try {
            String instruction = producer.produce(started, previousResult);
            if (instruction == null || instruction.isBlank()) {
                throw new InstructionProductionException(
                        "Empty instruction produced for work order " + started.taskId());
            }
            var result = new LinkedHashMap<String, Object>();
            if (started.result() != null) {
                result.putAll(started.result());
            }
            result.put("instruction", instruction);
            log.debug("Produced instruction for {} ({} chars)", started.taskId(), instruction.length());
            return started.completed(result, clock.instant());
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Instruction production failed for work order {}: {}", started.taskId(), reason);
            return started.failed(reason, clock.instant());
        }
    }

    private WorkOrder await(Future<WorkOrder> future, WorkOrder started) {
        try {
            return future.get(productionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Instruction production for {} timed out after {}", started.taskId(), productionTimeout);
            return started.failed("Instruction production timed out after " + productionTimeout, clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Instruction production for {} failed: {}", started.taskId(), cause.getMessage());
            return started.failed(String.valueOf(cause.getMessage()), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return started.failed("Interrupted: " + e.getMessage(), clock.instant());
        }
    }

    /**
     * JSON handed to the next work order: the reported result without the instruction text.
     */
    private String carryOver(WorkOrder completed) {
        var carried = new LinkedHashMap<String, Object>();
        carried.put("taskId", completed.taskId());
        carried.put("executorId", completed.executorId());
        carried.put("status", completed.status().name());
        if (completed.result() != null) {
            completed.result().forEach((key, value) -> {
                if (!"instruction".equals(key)) {
                    carried.put(key, value);
                }
            });
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(carried);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialise result of work order {}, carrying its string form: {}",
                    completed.taskId(), e.getOriginalMessage());
            return String.valueOf(carried);
        }
    }

    private PipelineRun finish(String runId, DispatchMode mode, List<WorkOrder> outcomes, long startMs) {
        int succeeded = (int) outcomes.stream().filter(w -> w.status() == WorkOrderStatus.COMPLETED).count();
        int failed = (int) outcomes.stream().filter(w -> w.status() == WorkOrderStatus.FAILED).count();
        boolean allDone = succeeded == outcomes.size();
        long elapsedMs = System.currentTimeMillis() - startMs;

        String batch = InstructionBatchWriter.render(runId, mode, outcomes, succeeded, failed, clock.instant());
        var run = new PipelineRun(runId, mode, outcomes,
                allDone ? RunStatus.COMPLETED : RunStatus.FAILED,
                elapsedMs, succeeded, failed, batch);

        log.info("Run {} finished: {} succeeded, {} failed, {} pending in {}ms",
                runId, succeeded, failed, outcomes.size() - succeeded - failed, elapsedMs);
        if (metrics != null) {
            metrics.recordDispatch(mode, elapsedMs, succeeded, failed);
        }
        eventBus.publish(new PipelineEvent("batch.dispatched", runId, null,
                Map.of("mode", mode.name(), "succeeded", succeeded, "failed", failed),
                clock.instant()));
        return run;
    }

    /**
     * Generates a batch id in the format BATCH-YYYY-NNNN.
     */
    private String nextRunId() {
        int count = BATCH_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("BATCH-%d-%04d", year, count);
    }
}
