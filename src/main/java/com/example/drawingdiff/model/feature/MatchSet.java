package com.example.drawingdiff.model.feature;

import java.util.List;

/**
 * Correspondences that passed the ratio test, ordered by ascending descriptor distance.
 */
public record MatchSet(List<Correspondence> correspondences) {

    public MatchSet {
        correspondences = List.copyOf(correspondences);
    }

    public static MatchSet empty() {
        return new MatchSet(List.of());
    }

    public int size() {
        return correspondences.size();
    }
}
