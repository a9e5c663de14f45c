package com.example.drawingdiff.model.feature;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Keypoints of one page with their descriptors stored row-major in a single array: descriptor
 * {@code i} occupies {@code descriptors[i * descriptorLength, (i + 1) * descriptorLength)}. The
 * descriptor array is copied on the way in and on the way out.
 *
 * @param keypoints        detected keypoints, all strictly outside the excluded margin
 * @param descriptorLength number of values per descriptor
 * @param descriptors      flattened descriptor matrix
 * @param width            width of the source page
 * @param height           height of the source page
 * @param margin           excluded border width in pixels
 */
public record FeatureSet(
        List<Keypoint> keypoints,
        int descriptorLength,
        float[] descriptors,
        int width,
        int height,
        int margin) {

    public FeatureSet {
        keypoints = List.copyOf(keypoints);
        descriptors = Objects.requireNonNull(descriptors, "descriptors").clone();
        if (descriptors.length != keypoints.size() * descriptorLength) {
            throw new IllegalArgumentException("Descriptor matrix does not match the keypoint count");
        }
    }

    @Override
    public float[] descriptors() {
        return descriptors.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureSet)) {
            return false;
        }
        FeatureSet that = (FeatureSet) other;
        return descriptorLength == that.descriptorLength
                && width == that.width
                && height == that.height
                && margin == that.margin
                && keypoints.equals(that.keypoints)
                && Arrays.equals(descriptors, that.descriptors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keypoints, descriptorLength, width, height, margin) * 31 + Arrays.hashCode(descriptors);
    }

    @Override
    public String toString() {
        return "FeatureSet[keypoints=" + keypoints.size() + ", descriptorLength=" + descriptorLength
                + ", width=" + width + ", height=" + height + ", margin=" + margin + "]";
    }

    public static FeatureSet empty(int width, int height, int margin) {
        return new FeatureSet(List.of(), 0, new float[0], width, height, margin);
    }

    public int size() {
        return keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.isEmpty();
    }
}
