package com.quakesignal.engine.domain.model;

import java.util.Locale;

public enum WaveformMetric {

    RMS,
    ENERGY,
    PEAK_ABS,
    PEAK_FREQ;

    public String suffix() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String channelFor(String rawChannel) {
        return rawChannel + "." + suffix();
    }

    public static WaveformMetric ofChannel(String channel) {
        if (channel == null) return null;
        int dot = channel.lastIndexOf('.');
        if (dot < 0) return null;
        String suffix = channel.substring(dot + 1);
        for (WaveformMetric metric : values()) {
            if (metric.suffix().equals(suffix)) {
                return metric;
            }
        }
        return null;
    }

    public static boolean isDerived(String channel) {
        return ofChannel(channel) != null;
    }
}
