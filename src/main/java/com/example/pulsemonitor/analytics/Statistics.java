package com.example.pulsemonitor.analytics;

import java.util.Arrays;
import java.util.List;

/**
 * Closed-form statistics shared by the detector and the predictor.
 */
final class Statistics {

    private Statistics() {
    }

    record Line(double slope, double intercept) {
        double at(double x) {
            return intercept + slope * x;
        }
    }

    static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Population standard deviation.
     */
    static double stdDev(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double sq = 0.0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / values.length);
    }

    /**
     * Ordinary least squares against the index 0..n-1.
     */
    static Line ols(double[] values) {
        int n = values.length;
        if (n < 2) return new Line(0.0, n == 1 ? values[0] : 0.0);
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new Line(slope, intercept);
    }

    static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0.0);
    }

    static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0.0);
    }

    /**
     * Keep values inside [Q1 - 1.5 IQR, Q3 + 1.5 IQR], preserving order.
     */
    static double[] removeOutliers(double[] values) {
        if (values.length < 4) return values.clone();
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = sorted[(int) Math.floor(sorted.length * 0.25)];
        double q3 = sorted[(int) Math.floor(sorted.length * 0.75)];
        double iqr = q3 - q1;
        double lower = q1 - 1.5 * iqr;
        double upper = q3 + 1.5 * iqr;
        return Arrays.stream(values).filter(v -> v >= lower && v <= upper).toArray();
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(min, Math.min(max, value));
    }
}
