package com.healthsignal.service.detector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 孤立森林，每次运行用固定种子重新训练，不跨运行保存模型
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       每行一个观测（已标准化）
     * @param numTrees   树的数量
     * @param sampleSize 每棵树的子采样数，超过样本数时取样本数
     * @param seed       随机种子
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("孤立森林训练数据为空");
        }
        int effectiveSample = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSample, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.build(subsample(data, effectiveSample, random), maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), effectiveSample);
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n))，越接近 1 越离群
     */
    public double score(double[] point) {
        double c = IsolationTree.averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public double[] scoreAll(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // 部分 Fisher-Yates 洗牌
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
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
}
