package com.healthsignal.service.detector;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.Baseline;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.healthsignal.support.TestHealthDataFactory.alternating;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BaselineCalculatorTest {

    private final BaselineCalculator calculator = new BaselineCalculator();

    @Test
    void classicBaselineUsesMeanAndSampleStd() {
        List<Double> window = Arrays.asList(alternating(14, 6.8, 7.6));

        Baseline baseline = calculator.compute(HealthMetric.SLEEP_HOURS, window, AnomalyDetectionConfig.defaults());

        assertThat(baseline.center()).isCloseTo(7.2, within(1e-9));
        assertThat(baseline.scale()).isCloseTo(Math.sqrt(14 * 0.16 / 13), within(1e-9));
        assertThat(baseline.observations()).isEqualTo(14);
        assertThat(baseline.robust()).isFalse();
    }

    @Test
    void robustBaselineIgnoresSingleOutlier() {
        List<Double> window = new ArrayList<>(Arrays.asList(alternating(14, 6.8, 7.6)));
        window.add(0.5);
        AnomalyDetectionConfig config = AnomalyDetectionConfig.defaults().toBuilder().useRobust(true).build();

        Baseline baseline = calculator.compute(HealthMetric.SLEEP_HOURS, window, config);

        assertThat(baseline.center()).isCloseTo(6.8, within(1e-9));
        assertThat(baseline.scale()).isCloseTo(BaselineCalculator.MAD_SCALE * 0.8, within(1e-9));
        assertThat(baseline.robust()).isTrue();
    }

    @Test
    void adaptiveCenterLeansTowardRecentValues() {
        List<Double> window = new ArrayList<>(Collections.nCopies(14, 7.0));
        window.addAll(Collections.nCopies(3, 9.0));
        AnomalyDetectionConfig config = AnomalyDetectionConfig.defaults().toBuilder().useAdaptive(true).build();

        Baseline adaptive = calculator.compute(HealthMetric.SLEEP_HOURS, window, config);
        Baseline classic = calculator.compute(HealthMetric.SLEEP_HOURS, window, AnomalyDetectionConfig.defaults());

        assertThat(adaptive.center()).isGreaterThan(classic.center());
        assertThat(adaptive.adaptive()).isTrue();
    }

    @Test
    void ewmaWeightsDecayTowardOlderObservations() {
        double[] weights = BaselineCalculator.ewmaWeights(3, 0.25);

        assertThat(weights[2]).isEqualTo(1.0);
        assertThat(weights[1]).isCloseTo(0.75, within(1e-12));
        assertThat(weights[0]).isCloseTo(0.5625, within(1e-12));
    }

    @Test
    void rejectsWindowBelowMinimumObservations() {
        List<Double> window = Arrays.asList(alternating(13, 6.8, 7.6));

        assertThatThrownBy(() -> calculator.compute(HealthMetric.SLEEP_HOURS, window,
                AnomalyDetectionConfig.defaults()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void rejectsConstantWindow() {
        List<Double> window = Collections.nCopies(20, 7.0);

        assertThatThrownBy(() -> calculator.compute(HealthMetric.SLEEP_HOURS, window,
                AnomalyDetectionConfig.defaults()))
                .isInstanceOf(DegenerateScaleException.class);
    }
}
