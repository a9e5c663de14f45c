package com.example.drawingdiff.config;

import com.example.drawingdiff.service.alignment.AffineImageWarper;
import com.example.drawingdiff.service.alignment.ImageWarper;
import com.example.drawingdiff.service.alignment.RansacAffineEstimator;
import com.example.drawingdiff.service.alignment.TransformEstimator;
import com.example.drawingdiff.service.feature.FeatureExtractor;
import com.example.drawingdiff.service.feature.FeatureMatcher;
import com.example.drawingdiff.service.feature.RatioTestFeatureMatcher;
import com.example.drawingdiff.service.feature.SiftFeatureExtractor;
import com.example.drawingdiff.service.overlay.ContentMaskOverlayCompositor;
import com.example.drawingdiff.service.overlay.OverlayCompositor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the OpenCV backed pipeline stages. Each stage is declared against its interface so a
 * project can swap one implementation by declaring its own bean of that type.
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public FeatureExtractor featureExtractor(DrawingDiffProperties properties) {
        DrawingDiffProperties.Alignment alignment = properties.alignment();
        log.info("Using SIFT feature extractor with {} features and a {} border margin",
                alignment.nFeatures(), alignment.excludeMargin());
        return new SiftFeatureExtractor(alignment);
    }

    @Bean
    public FeatureMatcher featureMatcher(DrawingDiffProperties properties) {
        return new RatioTestFeatureMatcher(properties.alignment());
    }

    @Bean
    public TransformEstimator transformEstimator(DrawingDiffProperties properties) {
        return new RansacAffineEstimator(properties.alignment());
    }

    @Bean
    public ImageWarper imageWarper() {
        return new AffineImageWarper();
    }

    @Bean
    public OverlayCompositor overlayCompositor(DrawingDiffProperties properties) {
        return new ContentMaskOverlayCompositor(properties.overlay());
    }
}
