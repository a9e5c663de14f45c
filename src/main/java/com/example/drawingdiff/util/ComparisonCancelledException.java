package com.example.drawingdiff.util;

import java.util.Locale;

/**
 * Thrown from inside a pipeline when its {@link CancellationToken} fired.
 */
public class ComparisonCancelledException extends RuntimeException {

    private final CancellationToken.Reason reason;

    public ComparisonCancelledException(CancellationToken.Reason reason, String activity) {
        super(String.format(Locale.ROOT, "%s during %s",
                reason == CancellationToken.Reason.TIMEOUT ? "Timed out" : "Cancelled", activity));
        this.reason = reason;
    }

    public CancellationToken.Reason reason() {
        return reason;
    }

    public boolean isTimeout() {
        return reason == CancellationToken.Reason.TIMEOUT;
    }
}
