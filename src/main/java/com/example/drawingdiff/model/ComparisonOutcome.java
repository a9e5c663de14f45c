package com.example.drawingdiff.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal state of one drawing pair.
 *
 * @param pair       the compared pages
 * @param overlay    diff raster, only present for {@link ComparisonStatus#SUCCESS}
 * @param alignment  estimation result when estimation was reached or skipped for lack of keypoints
 * @param status     terminal status
 * @param stage      {@link PairStage#DONE} on success, otherwise the stage the pair stopped in
 * @param detail     human readable explanation, empty on success
 * @param elapsed    wall-clock time spent on the pair
 */
public record ComparisonOutcome(
        DrawingPair pair,
        OverlayImage overlay,
        AlignmentResult alignment,
        ComparisonStatus status,
        PairStage stage,
        String detail,
        Duration elapsed) {

    public ComparisonOutcome {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(stage, "stage");
        if (status == ComparisonStatus.SUCCESS && overlay == null) {
            throw new IllegalArgumentException("A successful comparison must carry an overlay");
        }
        detail = detail == null ? "" : detail;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /**
     * Empty when the pair could not be compared. A present {@code false} means the pages were
     * compared and no change exceeded the noise floor.
     */
    public Optional<Boolean> changesDetected() {
        return overlay == null ? Optional.empty() : Optional.of(overlay.changesDetected());
    }

    /**
     * {@code done} for successful pairs, {@code failed@<stage>} otherwise.
     */
    public String stageLabel() {
        if (status == ComparisonStatus.SUCCESS) {
            return "done";
        }
        return "failed@" + stage.name().toLowerCase(Locale.ROOT);
    }
}
