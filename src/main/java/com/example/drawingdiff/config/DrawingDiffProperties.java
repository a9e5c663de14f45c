package com.example.drawingdiff.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable configuration for the comparison pipeline. Every value is validated when the record is
 * constructed, so a component that receives one of these records can trust its contents.
 */
@ConfigurationProperties(prefix = "drawing-diff")
public record DrawingDiffProperties(
        @DefaultValue Alignment alignment,
        @DefaultValue Overlay overlay,
        @DefaultValue Batch batch) {

    public static DrawingDiffProperties defaults() {
        return new DrawingDiffProperties(Alignment.defaults(), Overlay.defaults(), Batch.defaults());
    }

    public DrawingDiffProperties {
        require(alignment != null, "alignment settings are required");
        require(overlay != null, "overlay settings are required");
        require(batch != null, "batch settings are required");
    }

    /**
     * Feature detection, matching and transform estimation settings.
     *
     * @param nFeatures                  maximum number of keypoints kept per page
     * @param excludeMargin              border fraction of {@code min(width, height)} ignored by detection
     * @param ratioThreshold             nearest-neighbour ratio test threshold
     * @param ransacReprojThreshold      inlier tolerance in pixels
     * @param maxIters                   upper bound on RANSAC iterations
     * @param confidence                 desired probability of drawing at least one outlier-free sample
     * @param scaleMin                   smallest accepted uniform scale
     * @param scaleMax                   largest accepted uniform scale
     * @param rotationDegMin             smallest accepted rotation in degrees
     * @param rotationDegMax             largest accepted rotation in degrees
     * @param minCorrespondences         correspondences required before estimation is attempted
     * @param cancellationPollInterval   RANSAC iterations between two cancellation checks
     */
    public record Alignment(
            @DefaultValue("10000") int nFeatures,
            @DefaultValue("0.2") double excludeMargin,
            @DefaultValue("0.75") double ratioThreshold,
            @DefaultValue("15.0") double ransacReprojThreshold,
            @DefaultValue("5000") int maxIters,
            @DefaultValue("0.95") double confidence,
            @DefaultValue("0.3") double scaleMin,
            @DefaultValue("2.5") double scaleMax,
            @DefaultValue("-30") double rotationDegMin,
            @DefaultValue("30") double rotationDegMax,
            @DefaultValue("4") int minCorrespondences,
            @DefaultValue("64") int cancellationPollInterval) {

        public static Alignment defaults() {
            return new Alignment(10_000, 0.2, 0.75, 15.0, 5000, 0.95, 0.3, 2.5, -30, 30, 4, 64);
        }

        public Alignment {
            require(nFeatures > 0, "n-features must be positive");
            require(excludeMargin >= 0 && excludeMargin < 0.5, "exclude-margin must be in [0, 0.5)");
            require(ratioThreshold > 0 && ratioThreshold <= 1, "ratio-threshold must be in (0, 1]");
            require(ransacReprojThreshold > 0, "ransac-reproj-threshold must be positive");
            require(maxIters > 0, "max-iters must be positive");
            require(confidence > 0 && confidence < 1, "confidence must be in (0, 1)");
            require(scaleMin > 0, "scale-min must be positive");
            require(scaleMin < scaleMax, "scale-min must be lower than scale-max");
            require(rotationDegMin < rotationDegMax, "rotation-deg-min must be lower than rotation-deg-max");
            require(minCorrespondences >= 2, "min-correspondences must be at least 2");
            require(cancellationPollInterval > 0, "cancellation-poll-interval must be positive");
        }
    }

    /**
     * @param contentThreshold  intensities strictly below this value count as drawing content
     * @param minChangedPixels  removed + added pixels must exceed this floor to report changes
     * @param maxDimension      largest accepted page width or height in pixels
     */
    public record Overlay(
            @DefaultValue("240") int contentThreshold,
            @DefaultValue("0") long minChangedPixels,
            @DefaultValue("15000") int maxDimension) {

        public static Overlay defaults() {
            return new Overlay(240, 0, 15_000);
        }

        public Overlay {
            require(contentThreshold > 0 && contentThreshold <= 255, "content-threshold must be in [1, 255]");
            require(minChangedPixels >= 0, "min-changed-pixels must not be negative");
            require(maxDimension > 0, "max-dimension must be positive");
        }
    }

    /**
     * @param workerThreads  size of the pair worker pool, {@code 0} sizes it to the available processors
     * @param pairTimeout    wall-clock budget of one pair pipeline
     */
    public record Batch(
            @DefaultValue("0") int workerThreads,
            @DefaultValue("5m") Duration pairTimeout) {

        public static Batch defaults() {
            return new Batch(0, Duration.ofMinutes(5));
        }

        public Batch {
            require(workerThreads >= 0, "worker-threads must not be negative");
            require(pairTimeout != null && !pairTimeout.isNegative() && !pairTimeout.isZero(),
                    "pair-timeout must be positive");
        }

        public int effectiveWorkerThreads() {
            return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
