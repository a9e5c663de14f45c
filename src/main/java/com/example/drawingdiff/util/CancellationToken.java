package com.example.drawingdiff.util;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a running pair pipeline and whoever supervises it.
 * Work checks the token at stage boundaries and periodically inside long loops. A token created
 * with {@link #child()} also observes the cancellation of its parent.
 */
public final class CancellationToken {

    public enum Reason {
        TIMEOUT,
        CANCELLED
    }

    private final CancellationToken parent;
    private final AtomicReference<Reason> reason = new AtomicReference<>();

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /**
     * Marks the token as timed out. Returns {@code false} when it was already cancelled.
     */
    public boolean expire() {
        return reason.compareAndSet(null, Reason.TIMEOUT);
    }

    public boolean cancel() {
        return reason.compareAndSet(null, Reason.CANCELLED);
    }

    public Reason reason() {
        Reason own = reason.get();
        if (own != null) {
            return own;
        }
        return parent == null ? null : parent.reason();
    }

    public boolean isCancelled() {
        return reason() != null;
    }

    public void throwIfCancelled(String activity) {
        Reason current = reason();
        if (current != null) {
            throw new ComparisonCancelledException(current, activity);
        }
    }
}
