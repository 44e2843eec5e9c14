package com.quakesignal.engine.domain.service.quality;

public enum OutlierAction {
    SET_NAN,
    CLIP,
    KEEP
}
