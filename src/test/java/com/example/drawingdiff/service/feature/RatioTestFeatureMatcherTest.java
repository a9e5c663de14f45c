package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.feature.Correspondence;
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.Keypoint;
import com.example.drawingdiff.model.feature.MatchSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RatioTestFeatureMatcherTest {

    private final RatioTestFeatureMatcher matcher = new RatioTestFeatureMatcher(DrawingDiffProperties.Alignment.defaults());

    @Test
    void shouldKeepDistinctiveMatchesAndDropAmbiguousOnes() {
        FeatureSet oldFeatures = features(new float[][] {
                {1, 0, 0, 0},
                {0, 1, 0, 0},
                {0, 0, 1, 0}
        });
        FeatureSet newFeatures = features(new float[][] {
                {1, 0, 0, 0},
                {0, 0, 0, 1},
                {0, 1, 0, 0.1f}
        });

        MatchSet matches = matcher.match(oldFeatures, newFeatures);

        assertThat(matches.size()).isEqualTo(2);
        Correspondence first = matches.correspondences().get(0);
        assertThat(first.oldIndex()).isZero();
        assertThat(first.newIndex()).isZero();
        assertThat(first.distance()).isCloseTo(0.0, within(1e-6));
        Correspondence second = matches.correspondences().get(1);
        assertThat(second.oldIndex()).isEqualTo(1);
        assertThat(second.newIndex()).isEqualTo(2);
        assertThat(second.oldX()).isEqualTo(110.0);
        assertThat(second.newX()).isEqualTo(130.0);
        assertThat(second.distance()).isCloseTo(0.1, within(1e-6));
    }

    @Test
    void shouldReturnEmptyWhenNewPageHasSingleKeypoint() {
        FeatureSet oldFeatures = features(new float[][] {{1, 0}, {0, 1}});
        FeatureSet newFeatures = features(new float[][] {{1, 0}});

        assertThat(matcher.match(oldFeatures, newFeatures).size()).isZero();
        assertThat(matcher.match(FeatureSet.empty(10, 10, 0), oldFeatures).size()).isZero();
    }

    @Test
    void shouldRejectIncompatibleDescriptors() {
        FeatureSet oldFeatures = features(new float[][] {{1, 0}, {0, 1}});
        FeatureSet newFeatures = features(new float[][] {{1, 0, 0}, {0, 1, 0}});

        assertThatThrownBy(() -> matcher.match(oldFeatures, newFeatures))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Keypoint {@code i} sits at {@code (100 + 10 * i, 50)}.
     */
    private static FeatureSet features(float[][] rows) {
        int length = rows[0].length;
        float[] flat = new float[rows.length * length];
        Keypoint[] keypoints = new Keypoint[rows.length];
        for (int i = 0; i < rows.length; i++) {
            System.arraycopy(rows[i], 0, flat, i * length, length);
            keypoints[i] = new Keypoint(100 + 10 * i, 50, 4, -1, 1);
        }
        return new FeatureSet(List.of(keypoints), length, flat, 500, 500, 0);
    }
}
