package com.example.drawingdiff.service.overlay;

import org.opencv.core.Scalar;

/**
 * Pixel classes of an overlay with their fixed colors. Colors are declared as RGB; OpenCV and
 * {@code TYPE_3BYTE_BGR} rasters store them in B,G,R byte order, see {@link #bgr()}.
 */
public enum DiffClass {
    /** Content only on the old page: light red. Stored bytes 100,100,255. */
    REMOVED(255, 100, 100),
    /** Content only on the new page: light green. Stored bytes 100,255,100. */
    ADDED(100, 255, 100),
    /** Content on both pages: gray. Stored bytes 150,150,150. */
    UNCHANGED(150, 150, 150),
    /** No content on either page: white paper. */
    BACKGROUND(255, 255, 255);

    private final int red;
    private final int green;
    private final int blue;

    DiffClass(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    /**
     * Packed {@code 0xRRGGBB} value as returned by {@link java.awt.image.BufferedImage#getRGB}
     * without the alpha byte.
     */
    public int rgb() {
        return (red << 16) | (green << 8) | blue;
    }

    /**
     * Channel values in storage order: blue, green, red.
     */
    public int[] bgr() {
        return new int[] {blue, green, red};
    }

    Scalar scalar() {
        return new Scalar(blue, green, red);
    }

    /**
     * Maps an overlay pixel back to its class, or {@code null} for colors no class uses.
     */
    public static DiffClass fromRgb(int rgb) {
        int masked = rgb & 0xFFFFFF;
        for (DiffClass diffClass : values()) {
            if (diffClass.rgb() == masked) {
                return diffClass;
            }
        }
        return null;
    }
}
