package com.quakesignal.engine.domain.service.run;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record RunContext(SortedMap<String, Object> configSnapshot, String paramsHash, RunManifestService manifest) {

    public RunContext {
        configSnapshot = Collections.unmodifiableSortedMap(new TreeMap<>(configSnapshot));
    }

    public static RunContext of(SortedMap<String, Object> snapshot, RunManifestService manifest) {
        return new RunContext(snapshot, ParamsHasher.hash(snapshot), manifest);
    }

    public String shortHash() {
        return paramsHash.substring(0, Math.min(12, paramsHash.length()));
    }
}
