package com.example.drawingdiff.model;

import java.util.Objects;

/**
 * An old and a new page that share the same normalized identifier.
 */
public record DrawingPair(String identifier, PageImage oldPage, PageImage newPage) {

    public DrawingPair {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(oldPage, "oldPage");
        Objects.requireNonNull(newPage, "newPage");
        if (oldPage.revision() != Revision.OLD || newPage.revision() != Revision.NEW) {
            throw new IllegalArgumentException("A drawing pair needs one old and one new page");
        }
    }
}
