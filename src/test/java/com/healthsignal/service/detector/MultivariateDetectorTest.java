package com.healthsignal.service.detector;

import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.FeatureContribution;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.dto.analysis.MultivariateFlag;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.healthsignal.support.TestHealthDataFactory.gaussian;
import static com.healthsignal.support.TestHealthDataFactory.matrix;
import static org.assertj.core.api.Assertions.assertThat;

class MultivariateDetectorTest {

    private static final LocalDate END = LocalDate.of(2024, 3, 31);

    private final MultivariateDetector detector = new MultivariateDetector();

    @Test
    void flagsDayThatIsExtremeAcrossFeatures() {
        Map<HealthMetric, Double[]> columns = stableColumns(60);
        columns.get(HealthMetric.SLEEP_HOURS)[45] = 3.0;
        columns.get(HealthMetric.RESTING_HR)[45] = 95.0;
        columns.get(HealthMetric.TOTAL_CALORIES)[45] = 4500.0;
        FeatureMatrix matrix = matrix(END, columns);

        List<MultivariateFlag> flags = detector.detect(matrix, AnomalyDetectionConfig.defaults());

        assertThat(flags).isNotEmpty().hasSizeLessThanOrEqualTo(3);
        MultivariateFlag outlier = flags.stream()
                .filter(f -> f.date().equals(END.minusDays(14)))
                .findFirst()
                .orElseThrow();
        assertThat(outlier.normalizedScore()).isEqualTo(1.0);
        assertThat(outlier.contributors()).hasSize(2);
        List<FeatureContribution> contributors = outlier.contributors();
        assertThat(contributors.get(0).deviation()).isGreaterThanOrEqualTo(contributors.get(1).deviation());
        // 参照值回到原始量纲，接近正常日水平
        contributors.stream()
                .filter(c -> c.metric() == HealthMetric.RESTING_HR)
                .forEach(c -> assertThat(c.reference()).isBetween(55.0, 72.0));
    }

    @Test
    void incompleteDaysAreNeverFlagged() {
        Map<HealthMetric, Double[]> columns = stableColumns(60);
        columns.get(HealthMetric.SLEEP_HOURS)[30] = 2.0;
        columns.get(HealthMetric.TOTAL_CALORIES)[30] = 5000.0;
        columns.get(HealthMetric.RESTING_HR)[30] = null;
        FeatureMatrix matrix = matrix(END, columns);

        List<MultivariateFlag> flags = detector.detect(matrix, AnomalyDetectionConfig.defaults());

        assertThat(flags).noneMatch(f -> f.date().equals(END.minusDays(29)));
    }

    @Test
    void skipsWhenFewerThanThreeFeatures() {
        Map<HealthMetric, Double[]> columns = new EnumMap<>(HealthMetric.class);
        columns.put(HealthMetric.SLEEP_HOURS, gaussian(60, 7.2, 0.4, 1L));
        columns.put(HealthMetric.RESTING_HR, gaussian(60, 62, 3, 2L));

        assertThat(detector.detect(matrix(END, columns), AnomalyDetectionConfig.defaults())).isEmpty();
    }

    @Test
    void skipsWhenFewerThanTenObservedDays() {
        Map<HealthMetric, Double[]> columns = stableColumns(9);

        assertThat(detector.detect(matrix(END, columns), AnomalyDetectionConfig.defaults())).isEmpty();
    }

    @Test
    void derivedMetricsAreNotFeatures() {
        Map<HealthMetric, Double[]> columns = new EnumMap<>(HealthMetric.class);
        columns.put(HealthMetric.SLEEP_HOURS, gaussian(60, 7.2, 0.4, 1L));
        columns.put(HealthMetric.RESTING_HR, gaussian(60, 62, 3, 2L));
        columns.put(HealthMetric.WEIGHT_CHANGE_7D, gaussian(60, 0, 0.3, 3L));
        columns.put(HealthMetric.GLUCOSE_VARIABILITY, gaussian(60, 8, 2, 4L));

        assertThat(detector.detect(matrix(END, columns), AnomalyDetectionConfig.defaults())).isEmpty();
    }

    @Test
    void contaminationTailKeepsTies() {
        double[] scores = {0.1, 0.5, 0.5, 0.2};

        assertThat(MultivariateDetector.contaminationTail(scores, 0.25)).containsExactlyInAnyOrder(1, 2);
        assertThat(MultivariateDetector.contaminationTail(new double[]{0.3, 0.4, 0.9, 0.2, 0.1}, 0.4))
                .containsExactlyInAnyOrder(1, 2);
    }

    private static Map<HealthMetric, Double[]> stableColumns(int days) {
        Map<HealthMetric, Double[]> columns = new EnumMap<>(HealthMetric.class);
        columns.put(HealthMetric.SLEEP_HOURS, gaussian(days, 7.2, 0.4, 1L));
        columns.put(HealthMetric.RESTING_HR, gaussian(days, 62, 3, 2L));
        columns.put(HealthMetric.TOTAL_CALORIES, gaussian(days, 2100, 150, 3L));
        return columns;
    }
}
