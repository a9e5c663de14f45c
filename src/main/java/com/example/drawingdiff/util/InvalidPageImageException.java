package com.example.drawingdiff.util;

/**
 * Raised when a page raster cannot be processed, for example because it does not use the expected
 * pixel encoding.
 */
public class InvalidPageImageException extends IllegalArgumentException {

    public InvalidPageImageException(String message) {
        super(message);
    }
}
