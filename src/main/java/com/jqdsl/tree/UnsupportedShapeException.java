package com.jqdsl.tree;

/**
 * Thrown when a value handed to {@link TreeBuilder} is not a mapping, sequence or scalar where
 * one is expected.
 */
public class UnsupportedShapeException extends RuntimeException {
    public UnsupportedShapeException(String message) {
        super(message);
    }
}
