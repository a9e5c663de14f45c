package com.example.drawingdiff.model.feature;

/**
 * A detected local feature.
 *
 * @param x        column in pixels
 * @param y        row in pixels
 * @param size     diameter of the meaningful neighbourhood
 * @param angle    dominant orientation in degrees, {@code -1} when not applicable
 * @param response detector response, larger is stronger
 */
public record Keypoint(double x, double y, double size, double angle, double response) {
}
