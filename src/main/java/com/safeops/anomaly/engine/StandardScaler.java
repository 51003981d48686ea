package com.safeops.anomaly.engine;

/**
 * Per-column standardisation fitted on a pipeline's history.
 * Columns with zero variance keep a scale of 1.0, so they centre to 0.0 instead of dividing by zero.
 * Immutable once fitted; candidates are always transformed with the training-time statistics.
 */
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    private StandardScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static StandardScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty data set");
        }
        int dims = data[0].length;
        double[] means = new double[dims];
        double[] scales = new double[dims];

        for (double[] row : data) {
            for (int j = 0; j < dims; j++) means[j] += row[j];
        }
        for (int j = 0; j < dims; j++) means[j] /= data.length;

        for (double[] row : data) {
            for (int j = 0; j < dims; j++) {
                double d = row[j] - means[j];
                scales[j] += d * d;
            }
        }
        for (int j = 0; j < dims; j++) {
            double std = Math.sqrt(scales[j] / data.length);
            scales[j] = std > 0 ? std : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    public double[] transform(double[] point) {
        double[] out = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            out[j] = (point[j] - means[j]) / scales[j];
        }
        return out;
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = transform(data[i]);
        }
        return out;
    }

    public double[] getMeans() { return means.clone(); }
    public double[] getScales() { return scales.clone(); }
}
