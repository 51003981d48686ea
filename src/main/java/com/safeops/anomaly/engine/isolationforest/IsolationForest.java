package com.safeops.anomaly.engine.isolationforest;

import com.safeops.anomaly.engine.Percentiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest over already-standardised feature rows.
 *
 * <p>{@link #anomalyScore(double[])} is the classic {@code s(x) = 2^(-E[h(x)] / c(psi))} in (0, 1].
 * {@link #decisionFunction(double[])} shifts its negation by the training-set offset so that the
 * configured contamination share of the training rows falls below zero: positive means normal,
 * negative means anomalous.</p>
 *
 * Instances are immutable once fitted and safe to share between threads.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double offset;

    private IsolationForest(List<IsolationTree> trees, int sampleSize, double offset) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.offset = offset;
    }

    /**
     * Fit a forest.
     *
     * @param data          training rows
     * @param numTrees      ensemble size
     * @param maxSamples    sub-sample cap per tree; the effective size is {@code min(maxSamples, rows)}
     * @param contamination expected anomalous share of {@code data}, in (0, 0.5]
     * @param seed          random seed; identical inputs and seed give an identical forest
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples,
                                      double contamination, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on an empty data set");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }

        int sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.grow(subsample(data, sampleSize, random), heightLimit, random));
        }

        IsolationForest unshifted = new IsolationForest(Collections.unmodifiableList(trees), sampleSize, 0.0);
        double[] trainingNormality = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingNormality[i] = -unshifted.anomalyScore(data[i]);
        }
        double offset = Percentiles.of(trainingNormality, 100.0 * contamination);
        return new IsolationForest(unshifted.trees, sampleSize, offset);
    }

    public double anomalyScore(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double meanPath = total / trees.size();
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;
        return Math.pow(2.0, -meanPath / c);
    }

    /**
     * Normality relative to the contamination offset. Higher is more normal; below zero is an outlier.
     */
    public double decisionFunction(double[] point) {
        return -anomalyScore(point) - offset;
    }

    public boolean isOutlier(double[] point) {
        return decisionFunction(point) < 0;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return data.clone();
        }
        // Partial Fisher-Yates over row indices.
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
    public double getOffset() { return offset; }
}
