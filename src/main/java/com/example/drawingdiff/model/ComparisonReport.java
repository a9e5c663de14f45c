package com.example.drawingdiff.model;

import java.util.List;

/**
 * Outcomes of a whole batch, in the order of {@link ComparisonBatch#pairs()}.
 */
public record ComparisonReport(ComparisonBatch batch, List<ComparisonOutcome> outcomes) {

    public ComparisonReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(ComparisonStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public long successful() {
        return count(ComparisonStatus.SUCCESS);
    }

    public long failed() {
        return outcomes.size() - successful();
    }
}
