package com.example.drawingdiff.model;

public enum AlignmentFailure {
    /** One of the pages produced too few keypoints to match. */
    INSUFFICIENT_KEYPOINTS,
    /** Fewer correspondences survived the ratio test than estimation requires. */
    INSUFFICIENT_CORRESPONDENCES,
    /** No sample produced a usable model. */
    NO_CONSENSUS,
    /** The best transform exceeds the configured scale or rotation bounds. */
    CONSTRAINT_VIOLATION
}
