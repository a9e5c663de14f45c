package com.example.drawingdiff.service.overlay;

import com.example.drawingdiff.model.OverlayImage;

import java.awt.image.BufferedImage;

/**
 * Paints the diff overlay of two rasters that already share one coordinate frame.
 */
public interface OverlayCompositor {

    /**
     * @param alignedOld old page resampled into the new page's frame
     * @param current    new page raster, same size as {@code alignedOld}
     */
    OverlayImage composite(BufferedImage alignedOld, BufferedImage current);
}
