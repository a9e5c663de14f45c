package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.MatchSet;

/**
 * Pairs keypoints of an old page with keypoints of a new page.
 */
public interface FeatureMatcher {

    /**
     * @param oldFeatures features of the old page, the query side
     * @param newFeatures features of the new page, the train side
     * @return accepted correspondences, possibly empty
     */
    MatchSet match(FeatureSet oldFeatures, FeatureSet newFeatures);
}
