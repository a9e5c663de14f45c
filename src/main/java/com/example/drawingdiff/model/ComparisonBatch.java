package com.example.drawingdiff.model;

import java.util.List;

/**
 * Result of pairing two page collections: the pairs to compare, identifiers present on only one
 * side, and pages without any usable identifier.
 */
public record ComparisonBatch(
        List<DrawingPair> pairs,
        List<String> unmatchedOld,
        List<String> unmatchedNew,
        List<PageImage> unidentifiedOld,
        List<PageImage> unidentifiedNew) {

    public ComparisonBatch {
        pairs = List.copyOf(pairs);
        unmatchedOld = List.copyOf(unmatchedOld);
        unmatchedNew = List.copyOf(unmatchedNew);
        unidentifiedOld = List.copyOf(unidentifiedOld);
        unidentifiedNew = List.copyOf(unidentifiedNew);
    }

    public static ComparisonBatch of(List<DrawingPair> pairs) {
        return new ComparisonBatch(pairs, List.of(), List.of(), List.of(), List.of());
    }
}
