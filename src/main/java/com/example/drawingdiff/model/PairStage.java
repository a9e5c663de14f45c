package com.example.drawingdiff.model;

/**
 * Stages a drawing pair moves through. A failed pair keeps the stage it failed in.
 */
public enum PairStage {
    PENDING,
    EXTRACTING,
    MATCHING,
    ESTIMATING,
    WARPING,
    COMPOSITING,
    DONE
}
