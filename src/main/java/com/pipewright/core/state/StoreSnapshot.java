package com.pipewright.core.state;

import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackHistoryEntry;

import java.util.List;

/**
 * On-disk layout of the feedback store: {@code {"active": [...], "history": [...]}}.
 */
public record StoreSnapshot(List<FeedbackContext> active, List<FeedbackHistoryEntry> history) {

    public StoreSnapshot {
        active = active == null ? List.of() : List.copyOf(active);
        history = history == null ? List.of() : List.copyOf(history);
    }
}
