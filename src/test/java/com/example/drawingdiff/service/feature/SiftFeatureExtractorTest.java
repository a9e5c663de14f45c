package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.DrawingFixtures;
import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.Keypoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SiftFeatureExtractorTest {

    private final SiftFeatureExtractor extractor = new SiftFeatureExtractor(DrawingDiffProperties.Alignment.defaults());

    @Test
    void shouldFindNothingOnBlankPage() {
        FeatureSet features = extractor.extract(DrawingFixtures.oldPage(DrawingFixtures.blank(400, 300), "A-1"));

        assertThat(features.isEmpty()).isTrue();
        assertThat(features.margin()).isEqualTo(60);
    }

    @Test
    void shouldKeepKeypointsOutOfExcludedBorder() {
        FeatureSet features = extractor.extract(
                DrawingFixtures.oldPage(DrawingFixtures.texturedSheet(400, 7L, 0, 0), "A-1"));

        assertThat(features.size()).isGreaterThan(10);
        assertThat(features.margin()).isEqualTo(80);
        assertThat(features.descriptorLength()).isEqualTo(128);
        for (Keypoint keypoint : features.keypoints()) {
            assertThat(keypoint.x()).isGreaterThanOrEqualTo(80).isLessThan(320);
            assertThat(keypoint.y()).isGreaterThanOrEqualTo(80).isLessThan(320);
        }
    }

    @Test
    void shouldCapKeypointCount() {
        SiftFeatureExtractor capped = new SiftFeatureExtractor(new DrawingDiffProperties.Alignment(
                5, 0.1, 0.75, 15.0, 5000, 0.95, 0.3, 2.5, -30, 30, 4, 64));

        FeatureSet features = capped.extract(
                DrawingFixtures.oldPage(DrawingFixtures.texturedSheet(400, 7L, 0, 0), "A-1"));

        assertThat(features.size()).isLessThanOrEqualTo(5).isPositive();
    }

    @Test
    void shouldDeriveMarginFromShorterSide() {
        assertThat(SiftFeatureExtractor.marginFor(1000, 800, 0.2)).isEqualTo(160);
        assertThat(SiftFeatureExtractor.marginFor(1000, 1000, 0.0)).isZero();
    }
}
