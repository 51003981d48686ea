package com.safeops.anomaly.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int heightLimit, Random random) {
        return new IsolationTree(growNode(sample, 0, heightLimit, random));
    }

    private static IsolationNode growNode(double[][] rows, int depth, int heightLimit, Random random) {
        int n = rows.length;
        if (depth >= heightLimit || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int dims = rows[0].length;
        double[] min = new double[dims];
        double[] max = new double[dims];
        int[] splittable = new int[dims];
        int splittableCount = 0;
        for (int f = 0; f < dims; f++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                lo = Math.min(lo, row[f]);
                hi = Math.max(hi, row[f]);
            }
            min[f] = lo;
            max[f] = hi;
            if (hi > lo) splittable[splittableCount++] = f;
        }

        // Every remaining row is identical.
        if (splittableCount == 0) {
            return IsolationNode.leaf(n);
        }

        int feature = splittable[random.nextInt(splittableCount)];
        double threshold = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) leftCount++;
        }
        double[][] leftRows = new double[leftCount][];
        double[][] rightRows = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) {
                leftRows[li++] = row;
            } else {
                rightRows[ri++] = row;
            }
        }

        return IsolationNode.split(feature, threshold,
                growNode(leftRows, depth + 1, heightLimit, random),
                growNode(rightRows, depth + 1, heightLimit, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point);
    }
}
