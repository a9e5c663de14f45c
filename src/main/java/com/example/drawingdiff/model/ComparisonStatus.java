package com.example.drawingdiff.model;

public enum ComparisonStatus {
    SUCCESS,
    ALIGNMENT_FAILED,
    ERROR,
    TIMEOUT
}
