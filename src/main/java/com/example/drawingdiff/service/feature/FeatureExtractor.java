package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.model.feature.FeatureSet;

/**
 * Detects scale and rotation invariant keypoints on one page. Implementations must never return a
 * keypoint inside the configured border margin and return an empty {@link FeatureSet} rather than
 * failing when a page has no detectable content.
 */
public interface FeatureExtractor {

    FeatureSet extract(PageImage page);
}
