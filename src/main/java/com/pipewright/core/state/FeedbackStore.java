package com.pipewright.core.state;

import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackHistoryEntry;
import com.pipewright.core.model.LoopOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Process-wide store of active feedback loops and the history of closed ones.
 * <p>
 * Read-modify-write on a single loop is atomic. A loop id is removed from the active set
 * before its history entry is appended, so the two never overlap.
 */
public class FeedbackStore {

    private static final Logger log = LoggerFactory.getLogger(FeedbackStore.class);

    private final ConcurrentHashMap<String, FeedbackContext> active = new ConcurrentHashMap<>();
    /** (runId, stage, workOrderId) key to the loop id currently active for it. */
    private final ConcurrentHashMap<String, String> activeByKey = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<FeedbackHistoryEntry> history = new CopyOnWriteArrayList<>();

    public Optional<FeedbackContext> find(String loopId) {
        return Optional.ofNullable(active.get(loopId));
    }

    public Optional<FeedbackContext> findActive(String runId, String stage, String workOrderId) {
        String loopId = activeByKey.get(FeedbackContext.key(runId, stage, workOrderId));
        return loopId == null ? Optional.empty() : find(loopId);
    }

    /**
     * Returns the loop already active for the context's key, or stores the one supplied.
     */
    public FeedbackContext registerIfAbsent(String key, Supplier<FeedbackContext> factory) {
        var created = new boolean[1];
        String loopId = activeByKey.compute(key, (k, existing) -> {
            if (existing != null && active.containsKey(existing)) {
                return existing;
            }
            FeedbackContext context = factory.get();
            active.put(context.loopId(), context);
            created[0] = true;
            return context.loopId();
        });
        if (created[0]) {
            changed();
        }
        return active.get(loopId);
    }

    /**
     * Atomically replaces an active loop with the result of {@code change}.
     *
     * @throws IllegalArgumentException if the loop is not active
     */
    public FeedbackContext update(String loopId, UnaryOperator<FeedbackContext> change) {
        FeedbackContext updated = active.computeIfPresent(loopId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown or closed feedback loop: " + loopId);
        }
        changed();
        return updated;
    }

    /**
     * Moves a loop from the active set to history.
     *
     * @return the history entry, or empty if the loop was not active
     */
    public Optional<FeedbackHistoryEntry> close(String loopId, LoopOutcome outcome, Instant closedAt) {
        return close(loopId, outcome, closedAt, UnaryOperator.identity());
    }

    /**
     * Moves a loop to history after applying a last change to it.
     *
     * @return the history entry, or empty if the loop was not active
     */
    public Optional<FeedbackHistoryEntry> close(String loopId, LoopOutcome outcome, Instant closedAt,
                                                UnaryOperator<FeedbackContext> lastChange) {
        Optional<FeedbackHistoryEntry> entry = archive(loopId, outcome, closedAt, lastChange);
        entry.ifPresent(e -> changed());
        return entry;
    }

    /**
     * Closes {@code loopId} as ESCALATED and activates {@code successor} under the same key.
     */
    public FeedbackContext escalate(String loopId, FeedbackContext successor, Instant closedAt) {
        if (archive(loopId, LoopOutcome.ESCALATED, closedAt, UnaryOperator.identity()).isEmpty()) {
            throw new IllegalArgumentException("Unknown or closed feedback loop: " + loopId);
        }
        active.put(successor.loopId(), successor);
        activeByKey.put(successor.key(), successor.loopId());
        changed();
        return successor;
    }

    /**
     * Archives every active loop created before {@code cutoff} as EXPIRED.
     *
     * @return the number of loops removed
     */
    public int expireOlderThan(Instant cutoff, Instant now) {
        int removed = 0;
        for (FeedbackContext context : List.copyOf(active.values())) {
            if (!context.createdAt().isBefore(cutoff)) {
                continue;
            }
            if (archive(context.loopId(), LoopOutcome.EXPIRED, now, UnaryOperator.identity()).isPresent()) {
                log.warn("Expired feedback loop {} (opened {})", context.loopId(), context.createdAt());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Expired {} feedback loops created before {}", removed, cutoff);
            changed();
        }
        return removed;
    }

    public List<FeedbackContext> activeLoops() {
        return active.values().stream()
                .sorted(Comparator.comparing(FeedbackContext::createdAt).thenComparing(FeedbackContext::loopId))
                .toList();
    }

    public List<FeedbackContext> activeLoops(String runId) {
        return activeLoops().stream().filter(c -> c.runId().equals(runId)).toList();
    }

    public List<FeedbackHistoryEntry> history() {
        return List.copyOf(history);
    }

    public List<FeedbackHistoryEntry> history(String runId) {
        return history.stream().filter(e -> e.context().runId().equals(runId)).toList();
    }

    /** Replaces the whole content, used when loading persisted state. */
    protected void restore(List<FeedbackContext> activeLoops, List<FeedbackHistoryEntry> closed) {
        active.clear();
        activeByKey.clear();
        history.clear();
        for (FeedbackContext context : activeLoops) {
            active.put(context.loopId(), context);
            activeByKey.put(context.key(), context.loopId());
        }
        history.addAll(closed);
    }

    /** Called after every mutation. */
    protected void changed() {
    }

    private Optional<FeedbackHistoryEntry> archive(String loopId, LoopOutcome outcome, Instant closedAt,
                                                   UnaryOperator<FeedbackContext> lastChange) {
        FeedbackContext removed = active.remove(loopId);
        if (removed == null) {
            return Optional.empty();
        }
        activeByKey.remove(removed.key(), loopId);
        var entry = new FeedbackHistoryEntry(lastChange.apply(removed), outcome, closedAt);
        history.add(entry);
        log.debug("Closed feedback loop {} as {}", loopId, outcome);
        return Optional.of(entry);
    }

    List<FeedbackContext> snapshotActive() {
        return new ArrayList<>(activeLoops());
    }
}
