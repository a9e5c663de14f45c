package com.example.drawingdiff.service.comparison;

import com.example.drawingdiff.model.AlignmentResult;
import com.example.drawingdiff.model.ComparisonOutcome;
import com.example.drawingdiff.model.ComparisonStatus;
import com.example.drawingdiff.model.DrawingPair;
import com.example.drawingdiff.model.OverlayImage;
import com.example.drawingdiff.model.PairStage;
import com.example.drawingdiff.util.CancellationToken;

import java.time.Duration;
import java.util.Locale;

/**
 * Mutable progress of one pair while it runs. The stage is read by the timeout watchdog from
 * another thread, hence volatile.
 */
public final class PairExecution {

    private final DrawingPair pair;
    private final CancellationToken token;
    private volatile PairStage stage = PairStage.PENDING;
    private volatile long startedAt;

    public PairExecution(DrawingPair pair, CancellationToken token) {
        this.pair = pair;
        this.token = token;
    }

    public DrawingPair pair() {
        return pair;
    }

    public CancellationToken token() {
        return token;
    }

    public PairStage stage() {
        return stage;
    }

    void start() {
        startedAt = System.nanoTime();
    }

    /**
     * Moves to {@code next} unless the token fired while the current stage was running.
     */
    void advance(PairStage next) {
        token.throwIfCancelled(describe(stage));
        stage = next;
    }

    void checkpoint() {
        token.throwIfCancelled(describe(stage));
    }

    Duration elapsed() {
        return startedAt == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - startedAt);
    }

    ComparisonOutcome succeeded(OverlayImage overlay, AlignmentResult alignment) {
        return new ComparisonOutcome(pair, overlay, alignment, ComparisonStatus.SUCCESS, PairStage.DONE, "", elapsed());
    }

    ComparisonOutcome failed(ComparisonStatus status, AlignmentResult alignment, String detail) {
        return new ComparisonOutcome(pair, null, alignment, status, stage, detail, elapsed());
    }

    ComparisonOutcome timedOut(Duration budget) {
        return failed(ComparisonStatus.TIMEOUT, null, String.format(Locale.ROOT,
                "Exceeded the %d ms budget during %s", budget.toMillis(), describe(stage)));
    }

    static String describe(PairStage stage) {
        return stage.name().toLowerCase(Locale.ROOT);
    }
}
