package com.quakesignal.engine.domain.service.feature;

public final class StaLtaTrigger {

    private final int staPoints;
    private final int ltaPoints;
    private final double triggerOn;
    private final double triggerOff;

    public StaLtaTrigger(int staPoints, int ltaPoints, double triggerOn, double triggerOff) {
        this.staPoints = staPoints;
        this.ltaPoints = ltaPoints;
        this.triggerOn = triggerOn;
        this.triggerOff = triggerOff;
    }

    public static StaLtaTrigger from(FeatureProperties.StaLta config) {
        return new StaLtaTrigger(config.getStaPoints(), config.getLtaPoints(),
                config.getTriggerOn(), config.getTriggerOff());
    }

    public double[] ratios(double[] envelope) {
        int n = envelope.length;
        double[] ratios = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < ltaPoints - 1) {
                ratios[i] = Double.NaN;
                continue;
            }
            double sta = trailingMeanAbs(envelope, i, staPoints);
            double lta = trailingMeanAbs(envelope, i, ltaPoints);
            ratios[i] = lta > 0 && Double.isFinite(sta) ? sta / lta : Double.NaN;
        }
        return ratios;
    }

    public Detection detect(long[] tsMs, double[] envelope) {
        double[] ratios = ratios(envelope);
        double maxRatio = Double.NaN;
        int onset = -1;
        boolean stabilized = false;
        for (int i = 0; i < ratios.length; i++) {
            double r = ratios[i];
            if (!Double.isFinite(r)) continue;
            maxRatio = Double.isNaN(maxRatio) ? r : Math.max(maxRatio, r);
            if (onset < 0 && r >= triggerOn) {
                onset = i;
            } else if (onset >= 0 && !stabilized && r <= triggerOff) {
                stabilized = true;
            }
        }
        Long onsetTs = onset >= 0 && stabilized ? tsMs[onset] : null;
        return new Detection(maxRatio, onsetTs);
    }

    private static double trailingMeanAbs(double[] values, int end, int length) {
        double sum = 0.0;
        int count = 0;
        for (int i = end - length + 1; i <= end; i++) {
            if (Double.isFinite(values[i])) {
                sum += Math.abs(values[i]);
                count++;
            }
        }
        return count * 2 >= length ? sum / count : Double.NaN;
    }

    public record Detection(double maxRatio, Long onsetTsMs) {

        public boolean hasOnset() {
            return onsetTsMs != null;
        }
    }
}
