package com.example.drawingdiff.service.alignment;

import com.example.drawingdiff.model.AffineTransform;
import com.example.drawingdiff.model.PageImage;

import java.awt.image.BufferedImage;

/**
 * Resamples a page into another page's coordinate frame.
 */
public interface ImageWarper {

    /**
     * @param source    page to resample, normally the old revision
     * @param transform mapping from source coordinates to target coordinates
     * @param width     target width
     * @param height    target height
     * @return a raster of exactly {@code width x height} pixels in the page pixel encoding
     */
    BufferedImage warp(PageImage source, AffineTransform transform, int width, int height);

    default BufferedImage warpOnto(PageImage source, AffineTransform transform, PageImage target) {
        return warp(source, transform, target.width(), target.height());
    }
}
