package com.example.drawingdiff.service.comparison;

import com.example.drawingdiff.DrawingFixtures;
import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.AffineTransform;
import com.example.drawingdiff.model.AlignmentFailure;
import com.example.drawingdiff.model.AlignmentResult;
import com.example.drawingdiff.model.ComparisonOutcome;
import com.example.drawingdiff.model.ComparisonStatus;
import com.example.drawingdiff.model.DrawingPair;
import com.example.drawingdiff.model.OverlayImage;
import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.model.PairStage;
import com.example.drawingdiff.model.Revision;
import com.example.drawingdiff.model.feature.Correspondence;
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.Keypoint;
import com.example.drawingdiff.model.feature.MatchSet;
import com.example.drawingdiff.service.alignment.ImageWarper;
import com.example.drawingdiff.service.alignment.TransformEstimator;
import com.example.drawingdiff.service.feature.FeatureExtractor;
import com.example.drawingdiff.service.feature.FeatureMatcher;
import com.example.drawingdiff.service.overlay.OverlayCompositor;
import com.example.drawingdiff.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PairPipelineTest {

    private final FeatureExtractor extractor = mock(FeatureExtractor.class);
    private final FeatureMatcher matcher = mock(FeatureMatcher.class);
    private final TransformEstimator estimator = mock(TransformEstimator.class);
    private final ImageWarper warper = mock(ImageWarper.class);
    private final OverlayCompositor compositor = mock(OverlayCompositor.class);

    private final PairPipeline pipeline = new PairPipeline(extractor, matcher, estimator, warper, compositor,
            DrawingDiffProperties.defaults());

    private final BufferedImage raster = DrawingFixtures.blank(20, 20);
    private final DrawingPair pair = new DrawingPair("A-101",
            DrawingFixtures.oldPage(raster, "A-101"), DrawingFixtures.newPage(raster, "A-101"));
    private final FeatureSet features = new FeatureSet(
            List.of(new Keypoint(5, 5, 2, 0, 1), new Keypoint(12, 9, 2, 0, 1)), 1, new float[] {0f, 1f}, 20, 20, 0);
    private final MatchSet matches = new MatchSet(List.of(new Correspondence(5, 5, 5, 5, 0, 0, 0)));

    @BeforeEach
    void stubStages() {
        when(extractor.extract(any())).thenReturn(features);
        when(matcher.match(features, features)).thenReturn(matches);
        when(estimator.estimate(eq(matches), any())).thenReturn(AlignmentResult.success(AffineTransform.identity(), 1, 1));
        when(warper.warpOnto(any(), any(), any())).thenReturn(raster);
        when(compositor.composite(raster, raster)).thenReturn(new OverlayImage(raster, 0, 0, 0, false, 1.0));
    }

    @Test
    void shouldRunStagesInOrder() {
        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.SUCCESS);
        assertThat(outcome.stage()).isEqualTo(PairStage.DONE);
        assertThat(outcome.changesDetected()).contains(false);
        assertThat(outcome.alignment().score()).isEqualTo(1.0);
        InOrder order = inOrder(extractor, matcher, estimator, warper, compositor);
        order.verify(extractor).extract(pair.oldPage());
        order.verify(extractor).extract(pair.newPage());
        order.verify(matcher).match(features, features);
        order.verify(estimator).estimate(eq(matches), any());
        order.verify(warper).warpOnto(pair.oldPage(), AffineTransform.identity(), pair.newPage());
        order.verify(compositor).composite(raster, raster);
    }

    @Test
    void shouldFailAlignmentWhenKeypointsAreMissing() {
        when(extractor.extract(pair.newPage())).thenReturn(FeatureSet.empty(20, 20, 4));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ALIGNMENT_FAILED);
        assertThat(outcome.stage()).isEqualTo(PairStage.EXTRACTING);
        assertThat(outcome.alignment().failure()).isEqualTo(AlignmentFailure.INSUFFICIENT_KEYPOINTS);
        assertThat(outcome.changesDetected()).isEmpty();
        verifyNoInteractions(matcher, estimator);
    }

    @Test
    void shouldFailAlignmentWithoutConsensus() {
        when(estimator.estimate(eq(matches), any()))
                .thenReturn(AlignmentResult.failure(AlignmentFailure.NO_CONSENSUS, 1));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ALIGNMENT_FAILED);
        assertThat(outcome.stage()).isEqualTo(PairStage.ESTIMATING);
        assertThat(outcome.stageLabel()).isEqualTo("failed@estimating");
        assertThat(outcome.detail()).contains("No consistent transform");
        verifyNoInteractions(warper, compositor);
    }

    @Test
    void shouldReportRejectedTransformBounds() {
        when(estimator.estimate(eq(matches), any()))
                .thenReturn(AlignmentResult.rejected(AffineTransform.similarity(5.0, 0, 0, 0), 1, 1));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ALIGNMENT_FAILED);
        assertThat(outcome.alignment().score()).isZero();
        assertThat(outcome.detail()).contains("scale 5.000");
    }

    @Test
    void shouldConvertStageExceptionIntoError() {
        when(matcher.match(features, features)).thenThrow(new IllegalStateException("matcher exploded"));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ERROR);
        assertThat(outcome.stage()).isEqualTo(PairStage.MATCHING);
        assertThat(outcome.detail()).isEqualTo("matcher exploded");
    }

    @Test
    void shouldConvertLinkageErrorIntoError() {
        when(warper.warpOnto(any(), any(), any())).thenThrow(new UnsatisfiedLinkError("no opencv"));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ERROR);
        assertThat(outcome.stage()).isEqualTo(PairStage.WARPING);
    }

    @Test
    void shouldRejectUnsupportedEncodingBeforeAnyStage() {
        BufferedImage argb = new BufferedImage(20, 20, BufferedImage.TYPE_INT_ARGB);
        DrawingPair invalid = new DrawingPair("A-101",
                new PageImage(argb, "A-101", Revision.OLD, 0), DrawingFixtures.newPage(raster, "A-101"));

        ComparisonOutcome outcome = pipeline.run(new PairExecution(invalid, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ERROR);
        assertThat(outcome.detail()).contains("Unsupported pixel encoding");
        verifyNoInteractions(extractor);
    }

    @Test
    void shouldRejectOversizedPageBeforeAnyStage() {
        DrawingDiffProperties limited = new DrawingDiffProperties(DrawingDiffProperties.Alignment.defaults(),
                new DrawingDiffProperties.Overlay(240, 0, 15), DrawingDiffProperties.Batch.defaults());
        PairPipeline guarded = new PairPipeline(extractor, matcher, estimator, warper, compositor, limited);

        ComparisonOutcome outcome = guarded.run(new PairExecution(pair, new CancellationToken()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ERROR);
        assertThat(outcome.stage()).isEqualTo(PairStage.PENDING);
        assertThat(outcome.detail()).startsWith("Invalid input: old page 0 (A-101) is 20x20 px");
        verifyNoInteractions(extractor);
    }

    @Test
    void shouldReportTimeoutWhenTokenExpired() {
        CancellationToken token = new CancellationToken();
        when(matcher.match(features, features)).thenAnswer(invocation -> {
            token.expire();
            return matches;
        });

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, token));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.TIMEOUT);
        assertThat(outcome.stage()).isEqualTo(PairStage.MATCHING);
        assertThat(outcome.detail()).isEqualTo("Timed out during matching");
        verifyNoInteractions(estimator);
    }

    @Test
    void shouldReportCancellationAsError() {
        CancellationToken batch = new CancellationToken();
        batch.cancel();

        ComparisonOutcome outcome = pipeline.run(new PairExecution(pair, batch.child()));

        assertThat(outcome.status()).isEqualTo(ComparisonStatus.ERROR);
        assertThat(outcome.detail()).isEqualTo("cancelled");
        assertThat(outcome.stage()).isEqualTo(PairStage.PENDING);
    }
}
