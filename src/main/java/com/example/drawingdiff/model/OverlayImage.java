package com.example.drawingdiff.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Color-coded diff raster in {@link PageImage#PIXEL_ENCODING} together with the per-class pixel
 * counts it was painted from.
 *
 * @param raster           overlay pixels, same size as the new page
 * @param removedPixels    content present only in the aligned old page
 * @param addedPixels      content present only in the new page
 * @param unchangedPixels  content present in both
 * @param changesDetected  whether removed + added exceeded the configured noise floor
 * @param similarity       1 - mean absolute intensity difference / 255
 */
public record OverlayImage(
        BufferedImage raster,
        long removedPixels,
        long addedPixels,
        long unchangedPixels,
        boolean changesDetected,
        double similarity) {

    public OverlayImage {
        Objects.requireNonNull(raster, "raster");
    }

    public long changedPixels() {
        return removedPixels + addedPixels;
    }
}
