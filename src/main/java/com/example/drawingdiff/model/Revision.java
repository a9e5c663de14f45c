package com.example.drawingdiff.model;

/**
 * Which side of a comparison a page belongs to.
 */
public enum Revision {
    OLD,
    NEW
}
