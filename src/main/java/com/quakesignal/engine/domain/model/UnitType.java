package com.quakesignal.engine.domain.model;

public enum UnitType {
    PARTITION,
    EVENT
}
