package com.healthsignal.service.detector;

import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.DailyFeatureVector;
import com.healthsignal.model.dto.analysis.FeatureContribution;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.dto.analysis.MultivariateFlag;
import com.healthsignal.model.enums.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 多变量离群检测
 * 以天为观测、以覆盖率达标的原始指标为特征，中位数填补缺失后标准化，
 * 用孤立森林打分，分数落在污染率尾部且当天所有特征都有实测值的日期判为异常。
 * 异常归因到与最近若干正常日质心偏离最大的指标。
 */
@Slf4j
@Component
public class MultivariateDetector {

    static final int MIN_FEATURES = 3;
    static final int MIN_ROWS = 10;

    public List<MultivariateFlag> detect(FeatureMatrix matrix, AnomalyDetectionConfig config) {
        // 1. 选特征：全空或覆盖率不足的指标本次不参与
        List<HealthMetric> features = HealthMetric.anomalyMetrics().stream()
                .filter(m -> !m.isDerived())
                .filter(m -> matrix.coverage(m) >= config.getMinFeatureCoverage())
                .collect(Collectors.toList());
        if (features.size() < MIN_FEATURES) {
            log.debug("多变量检测跳过: userId={}, 可用特征数 {} < {}", matrix.getUserId(), features.size(), MIN_FEATURES);
            return Collections.emptyList();
        }

        // 2. 取至少有一个特征实测的日期作为观测
        List<DailyFeatureVector> rows = matrix.getRows().stream()
                .filter(r -> features.stream().anyMatch(r::has))
                .collect(Collectors.toList());
        int n = rows.size();
        if (n < MIN_ROWS) {
            log.debug("多变量检测跳过: userId={}, 观测天数 {} < {}", matrix.getUserId(), n, MIN_ROWS);
            return Collections.emptyList();
        }
        int d = features.size();

        // 3. 中位数填补 + 标准化
        double[] medians = new double[d];
        for (int f = 0; f < d; f++) {
            HealthMetric metric = features.get(f);
            double[] observed = rows.stream().filter(r -> r.has(metric)).mapToDouble(r -> r.get(metric)).toArray();
            medians[f] = new Median().evaluate(observed);
        }
        double[][] raw = new double[n][d];
        boolean[] complete = new boolean[n];
        for (int i = 0; i < n; i++) {
            complete[i] = true;
            for (int f = 0; f < d; f++) {
                Double value = rows.get(i).get(features.get(f));
                if (value == null) {
                    raw[i][f] = medians[f];
                    complete[i] = false;
                } else {
                    raw[i][f] = value;
                }
            }
        }
        double[] means = new double[d];
        double[] stds = new double[d];
        double[][] scaled = new double[n][d];
        for (int f = 0; f < d; f++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = raw[i][f];
            }
            means[f] = new Mean().evaluate(column);
            double std = new StandardDeviation(false).evaluate(column);
            // 常数列不携带信息，标准化后全为 0
            stds[f] = Double.isFinite(std) && std > 0 ? std : 1.0;
            for (int i = 0; i < n; i++) {
                scaled[i][f] = (raw[i][f] - means[f]) / stds[f];
            }
        }

        // 4. 孤立森林打分并做 min-max 归一化
        IsolationForest forest = IsolationForest.fit(scaled, config.getForestTrees(),
                config.getForestSampleSize(), config.getForestSeed());
        double[] scores = forest.scoreAll(scaled);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        if (!(max > min)) {
            log.debug("多变量检测: userId={}, 所有观测分数相同，无离群日", matrix.getUserId());
            return Collections.emptyList();
        }

        // 5. 污染率尾部：分数前 ceil(contamination·n) 名，并列一并计入
        Set<Integer> tail = contaminationTail(scores, config.getContamination());

        List<MultivariateFlag> flags = new ArrayList<>();
        for (int i : tail) {
            if (!complete[i]) {
                continue;
            }
            double normalized = (scores[i] - min) / (max - min);
            List<FeatureContribution> contributors = attribute(i, scaled, raw, tail, features, means, stds, config);
            flags.add(new MultivariateFlag(rows.get(i).getDate(), scores[i], normalized, contributors));
        }
        flags.sort(Comparator.comparing(MultivariateFlag::date));
        log.debug("多变量检测完成: userId={}, 特征={}, 观测={}, 尾部={}, 命中={}",
                matrix.getUserId(), d, n, tail.size(), flags.size());
        return flags;
    }

    static Set<Integer> contaminationTail(double[] scores, double contamination) {
        int n = scores.length;
        int k = (int) Math.ceil(contamination * n - 1e-9);
        k = Math.max(1, Math.min(k, n));
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        double cutoff = sorted[n - k];
        Set<Integer> tail = new HashSet<>();
        for (int i = 0; i < n; i++) {
            if (scores[i] >= cutoff) {
                tail.add(i);
            }
        }
        return tail;
    }

    /**
     * 以最近 k 个非尾部日期的质心为参照，按标准化距离降序取贡献最大的指标
     */
    private List<FeatureContribution> attribute(int index, double[][] scaled, double[][] raw, Set<Integer> tail,
                                                List<HealthMetric> features, double[] means, double[] stds,
                                                AnomalyDetectionConfig config) {
        int d = features.size();
        List<Integer> normals = new ArrayList<>();
        for (int j = 0; j < scaled.length; j++) {
            if (!tail.contains(j)) {
                normals.add(j);
            }
        }
        normals.sort(Comparator.comparingDouble((Integer j) -> squaredDistance(scaled[index], scaled[j]))
                .thenComparingInt(j -> j));
        List<Integer> neighbours = normals.subList(0, Math.min(config.getAttributionNeighbors(), normals.size()));

        double[] centroid = new double[d];
        if (!neighbours.isEmpty()) {
            for (int j : neighbours) {
                for (int f = 0; f < d; f++) {
                    centroid[f] += scaled[j][f];
                }
            }
            for (int f = 0; f < d; f++) {
                centroid[f] /= neighbours.size();
            }
        }

        List<FeatureContribution> contributions = new ArrayList<>(d);
        for (int f = 0; f < d; f++) {
            double deviation = Math.abs(scaled[index][f] - centroid[f]);
            double reference = centroid[f] * stds[f] + means[f];
            contributions.add(new FeatureContribution(features.get(f), raw[index][f], reference, deviation));
        }
        contributions.sort(Comparator.comparingDouble(FeatureContribution::deviation).reversed()
                .thenComparingInt(c -> c.metric().ordinal()));
        return contributions.subList(0, Math.min(config.getTopContributors(), contributions.size()));
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int f = 0; f < a.length; f++) {
            double diff = a[f] - b[f];
            sum += diff * diff;
        }
        return sum;
    }
}
