package com.quakesignal.engine.domain.exception;

public class SpatialIndexInvariantException extends IllegalStateException {

    public SpatialIndexInvariantException(String message) {
        super(message);
    }
}
