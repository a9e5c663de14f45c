package com.example.drawingdiff.service.alignment;

import com.example.drawingdiff.model.AffineTransform;
import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.util.MatConversions;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Bilinear affine resampling with OpenCV. Target pixels whose source falls outside the old page are
 * painted with the paper color so they never read as drawing content.
 */
public class AffineImageWarper implements ImageWarper {

    private static final Logger log = LoggerFactory.getLogger(AffineImageWarper.class);

    public static final Scalar BACKGROUND = new Scalar(255, 255, 255);

    @Override
    public BufferedImage warp(PageImage source, AffineTransform transform, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive but was " + width + "x" + height);
        }
        Mat input = MatConversions.toBgrMat(source);
        Mat matrix = new Mat(2, 3, CvType.CV_64F);
        Mat output = new Mat();
        try {
            matrix.put(0, 0, transform.toRowMajor());
            Imgproc.warpAffine(input, output, matrix, new Size(width, height),
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, BACKGROUND);
            log.debug("Warped {} from {}x{} onto {}x{}", source.describe(),
                    source.width(), source.height(), width, height);
            return MatConversions.toBufferedImage(output);
        } finally {
            input.release();
            matrix.release();
            output.release();
        }
    }
}
