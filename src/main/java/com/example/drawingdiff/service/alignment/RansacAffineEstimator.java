package com.example.drawingdiff.service.alignment;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.AffineTransform;
import com.example.drawingdiff.model.AlignmentFailure;
import com.example.drawingdiff.model.AlignmentResult;
import com.example.drawingdiff.model.feature.Correspondence;
import com.example.drawingdiff.model.feature.MatchSet;
import com.example.drawingdiff.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SplittableRandom;

/**
 * RANSAC estimation of a partial affine transform (rotation, uniform scale and translation).
 * Hypotheses come from random two-point samples; the best consensus set is refit with least
 * squares. The refit transform is then checked against the configured scale and rotation bounds,
 * and a transform outside them is rejected no matter how many inliers support it.
 *
 * <p>Sampling uses a fixed seed so the same matches always produce the same transform.
 */
public class RansacAffineEstimator implements TransformEstimator {

    private static final Logger log = LoggerFactory.getLogger(RansacAffineEstimator.class);

    private static final long SAMPLING_SEED = 0x5EED_D1FFL;
    private static final double DEGENERATE_SPAN = 1e-6;

    private final DrawingDiffProperties.Alignment settings;

    public RansacAffineEstimator(DrawingDiffProperties.Alignment settings) {
        this.settings = settings;
    }

    @Override
    public AlignmentResult estimate(MatchSet matches, CancellationToken token) {
        List<Correspondence> points = matches.correspondences();
        int total = points.size();
        if (total < settings.minCorrespondences()) {
            log.debug("Only {} correspondences, at least {} required", total, settings.minCorrespondences());
            return AlignmentResult.failure(AlignmentFailure.INSUFFICIENT_CORRESPONDENCES, total);
        }

        double thresholdSquared = settings.ransacReprojThreshold() * settings.ransacReprojThreshold();
        SplittableRandom random = new SplittableRandom(SAMPLING_SEED);
        AffineTransform best = null;
        int bestInliers = 0;
        long iterationLimit = settings.maxIters();

        for (long iteration = 0; iteration < iterationLimit; iteration++) {
            if (iteration % settings.cancellationPollInterval() == 0) {
                token.throwIfCancelled("transform estimation");
            }
            int first = random.nextInt(total);
            int second = random.nextInt(total - 1);
            if (second >= first) {
                second++;
            }
            AffineTransform candidate = fromTwoPoints(points.get(first), points.get(second));
            if (candidate == null) {
                continue;
            }
            int inliers = countInliers(candidate, points, thresholdSquared);
            if (inliers > bestInliers) {
                best = candidate;
                bestInliers = inliers;
                iterationLimit = Math.min(settings.maxIters(),
                        requiredIterations(inliers / (double) total, settings.confidence()));
            }
        }

        if (best == null) {
            log.debug("No non-degenerate sample among {} correspondences", total);
            return AlignmentResult.failure(AlignmentFailure.NO_CONSENSUS, total);
        }

        AffineTransform refined = refit(best, points, thresholdSquared);
        int refinedInliers = countInliers(refined, points, thresholdSquared);
        if (refinedInliers >= bestInliers) {
            best = refined;
            bestInliers = refinedInliers;
        }

        if (bestInliers < settings.minCorrespondences()) {
            log.debug("Best model is supported by only {} of {} correspondences", bestInliers, total);
            return AlignmentResult.failure(AlignmentFailure.NO_CONSENSUS, total);
        }
        if (!withinBounds(best)) {
            log.debug("Rejecting transform with scale {} and rotation {} deg ({} inliers)",
                    best.scale(), best.rotationDegrees(), bestInliers);
            return AlignmentResult.rejected(best, bestInliers, total);
        }

        AlignmentResult result = AlignmentResult.success(best, bestInliers, total);
        log.debug("Estimated scale {} rotation {} deg translation ({}, {}) with {}/{} inliers",
                best.scale(), best.rotationDegrees(), best.translationX(), best.translationY(), bestInliers, total);
        return result;
    }

    /**
     * Checks the decomposed scale and rotation of {@code transform} against the configured bounds.
     */
    public boolean withinBounds(AffineTransform transform) {
        double scale = transform.scale();
        double rotation = transform.rotationDegrees();
        return scale >= settings.scaleMin() && scale <= settings.scaleMax()
                && rotation >= settings.rotationDegMin() && rotation <= settings.rotationDegMax();
    }

    static long requiredIterations(double inlierRatio, double confidence) {
        double sampleSuccess = inlierRatio * inlierRatio;
        if (sampleSuccess >= 1.0) {
            return 1;
        }
        if (sampleSuccess <= 0.0) {
            return Long.MAX_VALUE;
        }
        double iterations = Math.log(1.0 - confidence) / Math.log(1.0 - sampleSuccess);
        return Math.max(1L, (long) Math.ceil(iterations));
    }

    private static AffineTransform fromTwoPoints(Correspondence p, Correspondence q) {
        double dx = q.oldX() - p.oldX();
        double dy = q.oldY() - p.oldY();
        double span = dx * dx + dy * dy;
        if (span < DEGENERATE_SPAN) {
            return null;
        }
        double ux = q.newX() - p.newX();
        double uy = q.newY() - p.newY();
        double a = (dx * ux + dy * uy) / span;
        double b = (dx * uy - dy * ux) / span;
        if (a * a + b * b < DEGENERATE_SPAN) {
            return null;
        }
        double tx = p.newX() - (a * p.oldX() - b * p.oldY());
        double ty = p.newY() - (b * p.oldX() + a * p.oldY());
        return new AffineTransform(a, -b, tx, b, a, ty);
    }

    private static int countInliers(AffineTransform transform, List<Correspondence> points, double thresholdSquared) {
        int inliers = 0;
        for (Correspondence point : points) {
            if (residualSquared(transform, point) <= thresholdSquared) {
                inliers++;
            }
        }
        return inliers;
    }

    private static double residualSquared(AffineTransform transform, Correspondence point) {
        double x = transform.m00() * point.oldX() + transform.m01() * point.oldY() + transform.m02();
        double y = transform.m10() * point.oldX() + transform.m11() * point.oldY() + transform.m12();
        double ex = x - point.newX();
        double ey = y - point.newY();
        return ex * ex + ey * ey;
    }

    /**
     * Least-squares similarity fit over the inliers of {@code model}.
     */
    private static AffineTransform refit(AffineTransform model, List<Correspondence> points, double thresholdSquared) {
        double sumOldX = 0;
        double sumOldY = 0;
        double sumNewX = 0;
        double sumNewY = 0;
        int count = 0;
        for (Correspondence point : points) {
            if (residualSquared(model, point) <= thresholdSquared) {
                sumOldX += point.oldX();
                sumOldY += point.oldY();
                sumNewX += point.newX();
                sumNewY += point.newY();
                count++;
            }
        }
        if (count < 2) {
            return model;
        }
        double meanOldX = sumOldX / count;
        double meanOldY = sumOldY / count;
        double meanNewX = sumNewX / count;
        double meanNewY = sumNewY / count;

        double dot = 0;
        double cross = 0;
        double norm = 0;
        for (Correspondence point : points) {
            if (residualSquared(model, point) <= thresholdSquared) {
                double px = point.oldX() - meanOldX;
                double py = point.oldY() - meanOldY;
                double qx = point.newX() - meanNewX;
                double qy = point.newY() - meanNewY;
                dot += px * qx + py * qy;
                cross += px * qy - py * qx;
                norm += px * px + py * py;
            }
        }
        if (norm < DEGENERATE_SPAN) {
            return model;
        }
        double a = dot / norm;
        double b = cross / norm;
        double tx = meanNewX - (a * meanOldX - b * meanOldY);
        double ty = meanNewY - (b * meanOldX + a * meanOldY);
        return new AffineTransform(a, -b, tx, b, a, ty);
    }
}
