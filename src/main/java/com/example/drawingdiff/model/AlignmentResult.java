package com.example.drawingdiff.model;

import java.util.Objects;

/**
 * Outcome of transform estimation. A failed result always carries a score of zero and a
 * {@link AlignmentFailure} reason; the transform is kept when one was estimated so callers can
 * inspect why it was rejected.
 */
public record AlignmentResult(
        AffineTransform transform,
        int inliers,
        int correspondences,
        double score,
        boolean success,
        AlignmentFailure failure) {

    public AlignmentResult {
        if (inliers < 0 || correspondences < 0 || inliers > correspondences) {
            throw new IllegalArgumentException("Inlier count must be within [0, correspondences]");
        }
        if (success) {
            Objects.requireNonNull(transform, "transform");
            if (failure != null) {
                throw new IllegalArgumentException("A successful alignment cannot carry a failure reason");
            }
        } else {
            Objects.requireNonNull(failure, "failure");
            score = 0.0;
        }
        score = Math.max(0.0, Math.min(1.0, score));
    }

    public static AlignmentResult success(AffineTransform transform, int inliers, int correspondences) {
        double score = correspondences == 0 ? 0.0 : inliers / (double) correspondences;
        return new AlignmentResult(transform, inliers, correspondences, score, true, null);
    }

    public static AlignmentResult failure(AlignmentFailure failure, int correspondences) {
        return new AlignmentResult(null, 0, correspondences, 0.0, false, failure);
    }

    public static AlignmentResult rejected(AffineTransform transform, int inliers, int correspondences) {
        return new AlignmentResult(transform, inliers, correspondences, 0.0, false,
                AlignmentFailure.CONSTRAINT_VIOLATION);
    }
}
