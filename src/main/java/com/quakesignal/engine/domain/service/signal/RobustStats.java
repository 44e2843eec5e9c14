package com.quakesignal.engine.domain.service.signal;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

public final class RobustStats {

    public static final double MAD_TO_SIGMA = 1.4826;
    public static final double IQR_TO_SIGMA = 1.349;

    private RobustStats() {
    }

    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static int finiteCount(double[] values) {
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) n++;
        }
        return n;
    }

    public static double nanFraction(double[] values) {
        if (values.length == 0) return 1.0;
        return 1.0 - (double) finiteCount(values) / values.length;
    }

    public static double mean(double[] finite) {
        if (finite.length == 0) return Double.NaN;
        return new Mean().evaluate(finite);
    }

    public static double populationStd(double[] finite) {
        if (finite.length == 0) return Double.NaN;
        return new StandardDeviation(false).evaluate(finite);
    }

    public static double populationVariance(double[] finite) {
        if (finite.length == 0) return Double.NaN;
        return new Variance(false).evaluate(finite);
    }

    public static double quantile(double[] finite, double q) {
        if (finite.length == 0) return Double.NaN;
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(finite, q * 100.0);
    }

    public static double median(double[] finite) {
        return quantile(finite, 0.5);
    }

    public static double mad(double[] finite, double center) {
        if (finite.length == 0) return Double.NaN;
        double[] deviations = new double[finite.length];
        for (int i = 0; i < finite.length; i++) {
            deviations[i] = Math.abs(finite[i] - center);
        }
        return median(deviations);
    }

    public static double meanAbsoluteDeviation(double[] finite, double center) {
        if (finite.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : finite) {
            sum += Math.abs(v - center);
        }
        return sum / finite.length;
    }

    public static double robustScale(double[] finite, double center) {
        double scale = MAD_TO_SIGMA * mad(finite, center);
        if (scale > 0) return scale;
        return meanAbsoluteDeviation(finite, center);
    }

    public static double iqrScale(double[] finite) {
        return (quantile(finite, 0.75) - quantile(finite, 0.25)) / IQR_TO_SIGMA;
    }
}
