package com.example.drawingdiff.service.comparison;

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
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.MatchSet;
import com.example.drawingdiff.service.alignment.ImageWarper;
import com.example.drawingdiff.service.alignment.TransformEstimator;
import com.example.drawingdiff.service.feature.FeatureExtractor;
import com.example.drawingdiff.service.feature.FeatureMatcher;
import com.example.drawingdiff.service.overlay.OverlayCompositor;
import com.example.drawingdiff.util.ComparisonCancelledException;
import com.example.drawingdiff.util.InvalidPageImageException;
import com.example.drawingdiff.util.MatConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Runs extraction, matching, estimation, warping and compositing for a single pair. Every failure
 * is turned into a {@link ComparisonOutcome}; nothing thrown by a stage leaves {@link #run}.
 */
@Component
public class PairPipeline {

    private static final Logger log = LoggerFactory.getLogger(PairPipeline.class);

    static final String CANCELLED = "cancelled";

    private static final int MIN_KEYPOINTS = 2;

    private final FeatureExtractor extractor;
    private final FeatureMatcher matcher;
    private final TransformEstimator estimator;
    private final ImageWarper warper;
    private final OverlayCompositor compositor;
    private final int maxDimension;

    public PairPipeline(FeatureExtractor extractor,
                        FeatureMatcher matcher,
                        TransformEstimator estimator,
                        ImageWarper warper,
                        OverlayCompositor compositor,
                        DrawingDiffProperties properties) {
        this.extractor = extractor;
        this.matcher = matcher;
        this.estimator = estimator;
        this.warper = warper;
        this.compositor = compositor;
        this.maxDimension = properties.overlay().maxDimension();
    }

    public ComparisonOutcome run(PairExecution execution) {
        DrawingPair pair = execution.pair();
        execution.start();
        try {
            MatConversions.requireSupported(pair.oldPage().raster(), pair.oldPage().describe());
            MatConversions.requireSupported(pair.newPage().raster(), pair.newPage().describe());
            requireWithinLimit(pair.oldPage());
            requireWithinLimit(pair.newPage());

            execution.advance(PairStage.EXTRACTING);
            FeatureSet oldFeatures = extractor.extract(pair.oldPage());
            execution.checkpoint();
            FeatureSet newFeatures = extractor.extract(pair.newPage());
            if (oldFeatures.size() < MIN_KEYPOINTS || newFeatures.size() < MIN_KEYPOINTS) {
                String detail = String.format(Locale.ROOT, "Not enough keypoints: %d old, %d new",
                        oldFeatures.size(), newFeatures.size());
                log.warn("Alignment failed for {}: {}", pair.identifier(), detail);
                return execution.failed(ComparisonStatus.ALIGNMENT_FAILED,
                        AlignmentResult.failure(AlignmentFailure.INSUFFICIENT_KEYPOINTS, 0), detail);
            }

            execution.advance(PairStage.MATCHING);
            MatchSet matches = matcher.match(oldFeatures, newFeatures);

            execution.advance(PairStage.ESTIMATING);
            AlignmentResult alignment = estimator.estimate(matches, execution.token());
            if (!alignment.success()) {
                String detail = describeFailure(alignment);
                log.warn("Alignment failed for {}: {}", pair.identifier(), detail);
                return execution.failed(ComparisonStatus.ALIGNMENT_FAILED, alignment, detail);
            }

            execution.advance(PairStage.WARPING);
            AffineTransform transform = alignment.transform();
            BufferedImage aligned = warper.warpOnto(pair.oldPage(), transform, pair.newPage());

            execution.advance(PairStage.COMPOSITING);
            OverlayImage overlay = compositor.composite(aligned, pair.newPage().raster());

            execution.advance(PairStage.DONE);
            log.info("Compared {} in {} ms: score {}, {} removed / {} added pixels",
                    pair.identifier(), execution.elapsed().toMillis(), alignment.score(),
                    overlay.removedPixels(), overlay.addedPixels());
            return execution.succeeded(overlay, alignment);
        } catch (ComparisonCancelledException e) {
            log.warn("Comparison of {} stopped: {}", pair.identifier(), e.getMessage());
            if (e.isTimeout()) {
                return execution.failed(ComparisonStatus.TIMEOUT, null, e.getMessage());
            }
            return execution.failed(ComparisonStatus.ERROR, null, CANCELLED);
        } catch (InvalidPageImageException e) {
            log.error("Invalid input for {}: {}", pair.identifier(), e.getMessage());
            return execution.failed(ComparisonStatus.ERROR, null, "Invalid input: " + e.getMessage());
        } catch (RuntimeException | LinkageError e) {
            log.error("Comparison of {} failed during {}", pair.identifier(),
                    PairExecution.describe(execution.stage()), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return execution.failed(ComparisonStatus.ERROR, null, message);
        }
    }

    private void requireWithinLimit(PageImage page) {
        if (page.width() > maxDimension || page.height() > maxDimension) {
            throw new InvalidPageImageException(String.format(Locale.ROOT,
                    "%s is %dx%d px, larger than the %d px limit",
                    page.describe(), page.width(), page.height(), maxDimension));
        }
    }

    private static String describeFailure(AlignmentResult alignment) {
        AlignmentFailure failure = alignment.failure();
        return switch (failure) {
            case INSUFFICIENT_KEYPOINTS -> "Not enough keypoints";
            case INSUFFICIENT_CORRESPONDENCES -> String.format(Locale.ROOT,
                    "Only %d correspondences survived the ratio test", alignment.correspondences());
            case NO_CONSENSUS -> String.format(Locale.ROOT,
                    "No consistent transform among %d correspondences", alignment.correspondences());
            case CONSTRAINT_VIOLATION -> String.format(Locale.ROOT,
                    "Transform outside bounds: scale %.3f, rotation %.2f deg",
                    alignment.transform().scale(), alignment.transform().rotationDegrees());
        };
    }
}
