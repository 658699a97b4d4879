package com.healthsignal.service.correlation;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static com.healthsignal.support.TestHealthDataFactory.gaussian;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PearsonCorrelationMethodTest {

    private final PearsonCorrelationMethod method = new PearsonCorrelationMethod();
    private final CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults();

    @Test
    void detectsStrongSameDayRelationship() {
        Double[] exercise = gaussian(60, 40, 10, 5L);
        Double[] quality = new Double[60];
        Random noise = new Random(9L);
        for (int i = 0; i < 60; i++) {
            quality[i] = 3 + 0.1 * exercise[i] + 0.3 * noise.nextGaussian();
        }

        CorrelationCandidate candidate = method.evaluate(HealthMetric.EXERCISE_MINUTES,
                HealthMetric.SLEEP_QUALITY, exercise, quality, config).orElseThrow();

        assertThat(candidate.value()).isGreaterThan(0.9);
        assertThat(candidate.pValue()).isLessThan(0.001);
        assertThat(candidate.lagDays()).isZero();
        assertThat(candidate.direction()).isEqualTo(CausalDirection.NONE);
        assertThat(candidate.sampleSize()).isEqualTo(60);
        assertThat(candidate.significant()).isTrue();
    }

    @Test
    void usesOnlyDaysObservedInBothSeries() {
        Double[] a = gaussian(30, 7, 1, 1L);
        Double[] b = gaussian(30, 60, 5, 2L);
        Arrays.fill(a, 0, 12, null);

        assertThatThrownBy(() -> method.evaluate(HealthMetric.SLEEP_HOURS, HealthMetric.RESTING_HR, a, b, config))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void rejectsConstantSeries() {
        Double[] a = new Double[30];
        Arrays.fill(a, 7.0);
        Double[] b = gaussian(30, 60, 5, 2L);

        assertThatThrownBy(() -> method.evaluate(HealthMetric.SLEEP_HOURS, HealthMetric.RESTING_HR, a, b, config))
                .isInstanceOf(DegenerateScaleException.class);
    }

    @Test
    void weakOrInsignificantResultsAreNotSignificant() {
        assertThat(PearsonCorrelationMethod.isSignificant(0.1, 0.6, config)).isFalse();
        assertThat(PearsonCorrelationMethod.isSignificant(0.25, 0.01, config)).isFalse();
        assertThat(PearsonCorrelationMethod.isSignificant(-0.45, 0.01, config)).isTrue();
    }
}
