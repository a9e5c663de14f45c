package com.example.drawingdiff.model.feature;

/**
 * A candidate pairing of an old keypoint with a new keypoint.
 */
public record Correspondence(
        double oldX,
        double oldY,
        double newX,
        double newY,
        double distance,
        int oldIndex,
        int newIndex) {
}
