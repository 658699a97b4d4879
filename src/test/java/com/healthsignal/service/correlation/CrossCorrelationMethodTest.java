package com.healthsignal.service.correlation;

import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import static com.healthsignal.support.TestHealthDataFactory.gaussian;
import static com.healthsignal.support.TestHealthDataFactory.shifted;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CrossCorrelationMethodTest {

    private final CrossCorrelationMethod method = new CrossCorrelationMethod();
    private final CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults();

    @Test
    void findsLagWhereFirstMetricLeads() {
        Double[] exercise = gaussian(60, 40, 10, 3L);
        Double[] hrv = shifted(exercise, 3, 40);

        CorrelationCandidate candidate = method.evaluate(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS,
                exercise, hrv, config).orElseThrow();

        assertThat(candidate.lagDays()).isEqualTo(3).isLessThanOrEqualTo(config.getCrossMaxLag());
        assertThat(candidate.direction()).isEqualTo(CausalDirection.A_CAUSES_B);
        assertThat(candidate.value()).isCloseTo(1.0, within(1e-9));
        assertThat(candidate.significant()).isTrue();
    }

    @Test
    void negativeLagMeansSecondMetricLeads() {
        Double[] exercise = gaussian(60, 40, 10, 3L);
        Double[] hrv = shifted(exercise, 2, 40);

        CorrelationCandidate candidate = method.evaluate(HealthMetric.HRV_MS, HealthMetric.EXERCISE_MINUTES,
                hrv, exercise, config).orElseThrow();

        assertThat(candidate.lagDays()).isEqualTo(2);
        assertThat(candidate.direction()).isEqualTo(CausalDirection.B_CAUSES_A);
    }

    @Test
    void requiresMinimumOverlapAtSomeLag() {
        Double[] a = gaussian(15, 7, 1, 1L);
        Double[] b = gaussian(15, 60, 5, 2L);

        assertThatThrownBy(() -> method.evaluate(HealthMetric.SLEEP_HOURS, HealthMetric.RESTING_HR, a, b, config))
                .isInstanceOf(InsufficientDataException.class);
    }
}
