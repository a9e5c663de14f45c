package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.feature.Correspondence;
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.Keypoint;
import com.example.drawingdiff.model.feature.MatchSet;
import com.example.drawingdiff.util.MatConversions;
import org.opencv.core.DMatch;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.features2d.DescriptorMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force L2 matcher applying Lowe's ratio test: a correspondence is kept only when its best
 * distance is below {@code ratioThreshold} times the second best distance.
 */
public class RatioTestFeatureMatcher implements FeatureMatcher {

    private static final Logger log = LoggerFactory.getLogger(RatioTestFeatureMatcher.class);

    private final double ratioThreshold;

    public RatioTestFeatureMatcher(DrawingDiffProperties.Alignment settings) {
        this.ratioThreshold = settings.ratioThreshold();
    }

    @Override
    public MatchSet match(FeatureSet oldFeatures, FeatureSet newFeatures) {
        if (oldFeatures.isEmpty() || newFeatures.size() < 2) {
            log.debug("Skipping matching: {} old and {} new keypoints", oldFeatures.size(), newFeatures.size());
            return MatchSet.empty();
        }
        if (oldFeatures.descriptorLength() != newFeatures.descriptorLength()) {
            throw new IllegalArgumentException("Descriptor lengths differ: "
                    + oldFeatures.descriptorLength() + " vs " + newFeatures.descriptorLength());
        }

        Mat query = MatConversions.toDescriptorMat(
                oldFeatures.descriptors(), oldFeatures.size(), oldFeatures.descriptorLength());
        Mat train = MatConversions.toDescriptorMat(
                newFeatures.descriptors(), newFeatures.size(), newFeatures.descriptorLength());
        List<MatOfDMatch> knnMatches = new ArrayList<>();
        try {
            DescriptorMatcher matcher = DescriptorMatcher.create(DescriptorMatcher.BRUTEFORCE);
            matcher.knnMatch(query, train, knnMatches, 2);

            List<Correspondence> accepted = new ArrayList<>();
            for (MatOfDMatch candidates : knnMatches) {
                DMatch[] nearest = candidates.toArray();
                if (nearest.length < 2) {
                    continue;
                }
                if (nearest[0].distance < ratioThreshold * nearest[1].distance) {
                    accepted.add(toCorrespondence(nearest[0], oldFeatures, newFeatures));
                }
            }
            accepted.sort(Comparator.comparingDouble(Correspondence::distance));
            log.debug("Ratio test kept {} of {} candidate matches", accepted.size(), knnMatches.size());
            return new MatchSet(accepted);
        } finally {
            query.release();
            train.release();
            knnMatches.forEach(Mat::release);
        }
    }

    private Correspondence toCorrespondence(DMatch match, FeatureSet oldFeatures, FeatureSet newFeatures) {
        Keypoint from = oldFeatures.keypoints().get(match.queryIdx);
        Keypoint to = newFeatures.keypoints().get(match.trainIdx);
        return new Correspondence(from.x(), from.y(), to.x(), to.y(), match.distance, match.queryIdx, match.trainIdx);
    }
}
