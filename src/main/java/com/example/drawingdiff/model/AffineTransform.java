package com.example.drawingdiff.model;

/**
 * A 2x3 affine matrix mapping old-page coordinates onto new-page coordinates:
 *
 * <pre>
 * x' = m00 * x + m01 * y + m02
 * y' = m10 * x + m11 * y + m12
 * </pre>
 *
 * Scale and rotation are read from the first column, which is exact for the rotation + uniform
 * scale + translation transforms the estimator produces.
 */
public record AffineTransform(double m00, double m01, double m02, double m10, double m11, double m12) {

    public static AffineTransform identity() {
        return new AffineTransform(1, 0, 0, 0, 1, 0);
    }

    public static AffineTransform translation(double dx, double dy) {
        return new AffineTransform(1, 0, dx, 0, 1, dy);
    }

    /**
     * Rotation by {@code degrees} (counter-clockwise in a y-up frame) and uniform {@code scale}
     * around the origin, followed by a translation.
     */
    public static AffineTransform similarity(double scale, double degrees, double dx, double dy) {
        double radians = Math.toRadians(degrees);
        double a = scale * Math.cos(radians);
        double b = scale * Math.sin(radians);
        return new AffineTransform(a, -b, dx, b, a, dy);
    }

    public double[] applyTo(double x, double y) {
        return new double[] {m00 * x + m01 * y + m02, m10 * x + m11 * y + m12};
    }

    public double scale() {
        return Math.hypot(m00, m10);
    }

    public double rotationDegrees() {
        return Math.toDegrees(Math.atan2(m10, m00));
    }

    public double translationX() {
        return m02;
    }

    public double translationY() {
        return m12;
    }

    /**
     * Row-major copy of the six coefficients, the layout expected by {@code Imgproc.warpAffine}.
     */
    public double[] toRowMajor() {
        return new double[] {m00, m01, m02, m10, m11, m12};
    }
}
