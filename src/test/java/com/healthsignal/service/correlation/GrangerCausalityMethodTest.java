package com.healthsignal.service.correlation;

import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static com.healthsignal.support.TestHealthDataFactory.gaussian;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class GrangerCausalityMethodTest {

    private final GrangerCausalityMethod method = new GrangerCausalityMethod();
    private final CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults();

    @Test
    void detectsYesterdayDrivingToday() {
        Double[] sugar = gaussian(60, 50, 15, 21L);
        Double[] quality = new Double[60];
        Random noise = new Random(22L);
        quality[0] = 7.0;
        for (int t = 1; t < 60; t++) {
            quality[t] = 7 + 0.08 * (sugar[t - 1] - 50) + 0.3 * noise.nextGaussian();
        }

        CorrelationCandidate candidate = method.evaluate(HealthMetric.SUGAR_G, HealthMetric.SLEEP_QUALITY,
                sugar, quality, config).orElseThrow();

        assertThat(candidate.direction()).isIn(CausalDirection.A_CAUSES_B, CausalDirection.BIDIRECTIONAL);
        assertThat(candidate.lagDays()).isEqualTo(1);
        assertThat(candidate.value()).isPositive();
        assertThat(candidate.pValue()).isLessThan(0.001);
        assertThat(candidate.fStatistic()).isNotNull().isPositive();
        assertThat(candidate.significant()).isTrue();
    }

    @Test
    void negativeDriverGivesNegativeValue() {
        Double[] sugar = gaussian(60, 50, 15, 31L);
        Double[] quality = new Double[60];
        Random noise = new Random(32L);
        quality[0] = 7.0;
        for (int t = 1; t < 60; t++) {
            quality[t] = 7 - 0.08 * (sugar[t - 1] - 50) + 0.3 * noise.nextGaussian();
        }

        CorrelationCandidate candidate = method.evaluate(HealthMetric.SUGAR_G, HealthMetric.SLEEP_QUALITY,
                sugar, quality, config).orElseThrow();

        assertThat(candidate.value()).isNegative();
    }

    @Test
    void lagTestNeedsEnoughCompleteRows() {
        Double[] cause = gaussian(15, 0, 1, 1L);
        Double[] effect = gaussian(15, 0, 1, 2L);

        assertThat(GrangerCausalityMethod.testLag(cause, effect, 1, config.getMinOverlap())).isEmpty();
    }

    @Test
    void collinearSeriesDoNotBreakTheLagTest() {
        Double[] cause = new Double[40];
        Double[] effect = new Double[40];
        Arrays.fill(cause, 3.0);
        Arrays.fill(effect, 5.0);

        assertThatCode(() -> GrangerCausalityMethod.testLag(cause, effect, 2, config.getMinOverlap()))
                .doesNotThrowAnyException();
    }
}
