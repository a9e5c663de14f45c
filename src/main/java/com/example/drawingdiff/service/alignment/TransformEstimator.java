package com.example.drawingdiff.service.alignment;

import com.example.drawingdiff.model.AlignmentResult;
import com.example.drawingdiff.model.feature.MatchSet;
import com.example.drawingdiff.util.CancellationToken;

/**
 * Robustly fits the transform that maps old-page coordinates onto the new page. Failures are
 * reported through {@link AlignmentResult#success()} rather than exceptions; only cancellation
 * escapes as {@link com.example.drawingdiff.util.ComparisonCancelledException}.
 */
public interface TransformEstimator {

    AlignmentResult estimate(MatchSet matches, CancellationToken token);

    default AlignmentResult estimate(MatchSet matches) {
        return estimate(matches, CancellationToken.none());
    }
}
