package com.example.drawingdiff.util;

import com.example.drawingdiff.model.PageImage;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Locale;

/**
 * Moves pixel and descriptor data between Java arrays and OpenCV matrices. Loading this class
 * loads the OpenCV native library, so every OpenCV call site goes through here first.
 */
public final class MatConversions {

    private static final Logger log = LoggerFactory.getLogger(MatConversions.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private MatConversions() {
    }

    /**
     * Copies a page raster into a new {@code CV_8UC3} matrix in B,G,R channel order.
     *
     * @throws InvalidPageImageException when the raster is empty or not {@code TYPE_3BYTE_BGR}
     */
    public static Mat toBgrMat(PageImage page) {
        return toBgrMat(page.raster(), page.describe());
    }

    public static Mat toBgrMat(BufferedImage image, String label) {
        requireSupported(image, label);
        byte[] data = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        if (data.length != image.getWidth() * image.getHeight() * 3) {
            // sub-images share a larger buffer, repack them first
            data = ((DataBufferByte) repack(image).getRaster().getDataBuffer()).getData();
        }
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * @throws InvalidPageImageException when the raster is empty or not {@code TYPE_3BYTE_BGR}
     */
    public static void requireSupported(BufferedImage image, String label) {
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidPageImageException("Empty raster for " + label);
        }
        if (image.getType() != PageImage.PIXEL_ENCODING) {
            throw new InvalidPageImageException(String.format(Locale.ROOT,
                    "Unsupported pixel encoding %d for %s, expected TYPE_3BYTE_BGR", image.getType(), label));
        }
    }

    private static BufferedImage repack(BufferedImage image) {
        BufferedImage packed = new BufferedImage(image.getWidth(), image.getHeight(), PageImage.PIXEL_ENCODING);
        Graphics2D graphics = packed.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return packed;
    }

    /**
     * Copies a {@code CV_8UC3} matrix into a new {@code TYPE_3BYTE_BGR} image.
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        if (mat.type() != CvType.CV_8UC3) {
            throw new IllegalArgumentException("Expected a CV_8UC3 matrix but got " + CvType.typeToString(mat.type()));
        }
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), PageImage.PIXEL_ENCODING);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, target);
        return image;
    }

    /**
     * Builds a {@code CV_32F} matrix with one descriptor per row.
     */
    public static Mat toDescriptorMat(float[] descriptors, int rows, int cols) {
        Mat mat = new Mat(rows, cols, CvType.CV_32F);
        if (rows > 0) {
            mat.put(0, 0, descriptors);
        }
        return mat;
    }

    public static float[] toDescriptorArray(Mat descriptors) {
        if (descriptors.empty()) {
            return new float[0];
        }
        Mat source = descriptors;
        if (descriptors.type() != CvType.CV_32F) {
            source = new Mat();
            descriptors.convertTo(source, CvType.CV_32F);
        }
        float[] values = new float[(int) (source.total() * source.channels())];
        source.get(0, 0, values);
        if (source != descriptors) {
            source.release();
        }
        return values;
    }
}
