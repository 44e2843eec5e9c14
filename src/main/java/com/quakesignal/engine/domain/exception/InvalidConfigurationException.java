package com.quakesignal.engine.domain.exception;

public class InvalidConfigurationException extends IllegalStateException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
