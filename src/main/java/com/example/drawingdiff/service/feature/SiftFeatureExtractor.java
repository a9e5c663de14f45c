package com.example.drawingdiff.service.feature;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.model.feature.FeatureSet;
import com.example.drawingdiff.model.feature.Keypoint;
import com.example.drawingdiff.util.MatConversions;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.Scalar;
import org.opencv.features2d.SIFT;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * SIFT based extractor. The page is converted to inverted grayscale so that ink becomes the bright
 * signal, and a border of {@code floor(min(h, w) * excludeMargin)} pixels is masked out so frames,
 * title blocks and revision clouds along the edges never contribute features.
 */
public class SiftFeatureExtractor implements FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(SiftFeatureExtractor.class);

    private final DrawingDiffProperties.Alignment settings;

    public SiftFeatureExtractor(DrawingDiffProperties.Alignment settings) {
        this.settings = settings;
    }

    public static int marginFor(int width, int height, double excludeMargin) {
        return (int) Math.floor(Math.min(width, height) * excludeMargin);
    }

    @Override
    public FeatureSet extract(PageImage page) {
        int width = page.width();
        int height = page.height();
        int margin = marginFor(width, height, settings.excludeMargin());
        if (width - 2 * margin <= 0 || height - 2 * margin <= 0) {
            log.debug("Margin {} leaves no detection area on {}", margin, page.describe());
            return FeatureSet.empty(width, height, margin);
        }

        Mat bgr = MatConversions.toBgrMat(page);
        Mat gray = new Mat();
        Mat inverted = new Mat();
        Mat mask = Mat.zeros(height, width, CvType.CV_8UC1);
        MatOfKeyPoint keypoints = new MatOfKeyPoint();
        Mat descriptors = new Mat();
        try {
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            Core.bitwise_not(gray, inverted);
            Mat interior = mask.submat(margin, height - margin, margin, width - margin);
            interior.setTo(new Scalar(255));
            interior.release();

            SIFT detector = SIFT.create(settings.nFeatures());
            detector.detectAndCompute(inverted, mask, keypoints, descriptors);

            FeatureSet features = collect(keypoints.toArray(), descriptors, width, height, margin);
            log.debug("Extracted {} keypoints from {} (margin {} px)", features.size(), page.describe(), margin);
            return features;
        } finally {
            bgr.release();
            gray.release();
            inverted.release();
            mask.release();
            keypoints.release();
            descriptors.release();
        }
    }

    private FeatureSet collect(KeyPoint[] detected, Mat descriptorMat, int width, int height, int margin) {
        if (detected.length == 0 || descriptorMat.empty()) {
            return FeatureSet.empty(width, height, margin);
        }
        int length = descriptorMat.cols();
        float[] values = MatConversions.toDescriptorArray(descriptorMat);

        List<Integer> order = new ArrayList<>(detected.length);
        for (int i = 0; i < detected.length; i++) {
            if (insideInterior(detected[i], width, height, margin)) {
                order.add(i);
            }
        }
        // SIFT may keep ties beyond nFeatures
        order.sort(Comparator.comparingDouble((Integer idx) -> detected[idx].response).reversed());
        if (order.size() > settings.nFeatures()) {
            order = order.subList(0, settings.nFeatures());
        }

        List<Keypoint> keypoints = new ArrayList<>(order.size());
        float[] kept = new float[order.size() * length];
        int row = 0;
        for (int idx : order) {
            KeyPoint keyPoint = detected[idx];
            keypoints.add(new Keypoint(keyPoint.pt.x, keyPoint.pt.y, keyPoint.size, keyPoint.angle, keyPoint.response));
            System.arraycopy(values, idx * length, kept, row * length, length);
            row++;
        }
        return new FeatureSet(keypoints, length, kept, width, height, margin);
    }

    private static boolean insideInterior(KeyPoint keyPoint, int width, int height, int margin) {
        double x = keyPoint.pt.x;
        double y = keyPoint.pt.y;
        return x >= margin && y >= margin && x < width - margin && y < height - margin;
    }
}
