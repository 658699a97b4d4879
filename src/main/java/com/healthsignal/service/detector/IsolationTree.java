package com.healthsignal.service.detector;

import java.util.Random;

/**
 * 孤立树：随机选特征、在 (min, max) 内随机切分，直到样本无法再分或达到高度上限
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * n 个样本的二叉搜索树平均失败查找路径长度 c(n)
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static Node grow(double[][] rows, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = rows[0].length;

        // 只在取值有差异的特征上切分
        int[] candidates = new int[features];
        double[] mins = new double[features];
        double[] maxs = new double[features];
        int candidateCount = 0;
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min = Math.min(min, row[f]);
                max = Math.max(max, row[f]);
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) {
                candidates[candidateCount++] = f;
            }
        }
        if (candidateCount == 0) {
            return Node.leaf(rows.length);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                leftCount++;
            }
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[rows.length - leftCount][];
        int l = 0;
        int r = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return Node.internal(feature, split,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    private static final class Node {
        final int feature;
        final double splitValue;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double splitValue, Node left, Node right, int size) {
            this.feature = feature;
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node internal(int feature, double splitValue, Node left, Node right) {
            return new Node(feature, splitValue, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
