package com.pipewright.core.feedback;

import com.pipewright.core.model.FeedbackHistoryEntry;

import java.io.Serializable;
import java.util.List;

/**
 * Feedback summary of one run.
 *
 * @param runId         the run
 * @param activeLoops   loops still open
 * @param closedLoops   loops closed for any reason other than escalation
 * @param totalRetries  failed attempts recorded across open and closed loops
 * @param successRate   share of closed loops that ended SUCCEEDED (0 when none closed)
 * @param recentHistory the most recent history entries, oldest first
 */
public record FeedbackStatus(
    String runId,
    List<ActiveLoop> activeLoops,
    int closedLoops,
    int totalRetries,
    double successRate,
    List<FeedbackHistoryEntry> recentHistory
) implements Serializable {

    public record ActiveLoop(String loopId, String stage, String executorId, int retryCount,
                             String failureReason) implements Serializable {}
}
