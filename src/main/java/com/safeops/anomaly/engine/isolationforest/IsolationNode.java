package com.safeops.anomaly.engine.isolationforest;

/**
 * Node of an isolation tree. Internal nodes route on {@code point[feature] < threshold};
 * leaves record how many training samples reached them.
 */
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int feature;
    private final double threshold;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int leafSize;

    private IsolationNode(int feature, double threshold, IsolationNode left, IsolationNode right, int leafSize) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.leafSize = leafSize;
    }

    static IsolationNode split(int feature, double threshold, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, threshold, left, right, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    /**
     * Depth at which the point lands in a leaf, plus the expected remaining depth for the
     * samples that leaf still holds.
     */
    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.leafSize);
    }

    /**
     * c(n): average path length of an unsuccessful BST search over n samples,
     * 2H(n-1) - 2(n-1)/n with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }
}
