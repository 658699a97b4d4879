package com.healthsignal.service.correlation;

import com.healthsignal.mapper.PopulationCorrelationMapper;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.dto.analysis.PopulationReference;
import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.entity.PopulationCorrelationStat;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationStrength;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CorrelationAggregatorTest {

    private static final Long USER_ID = 1L;
    private static final LocalDate START = LocalDate.of(2024, 2, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 31);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 31, 4, 0);

    private PopulationCorrelationMapper populationCorrelationMapper;
    private CorrelationAggregator aggregator;
    private final CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults();

    @BeforeEach
    void setUp() {
        populationCorrelationMapper = mock(PopulationCorrelationMapper.class);
        aggregator = new CorrelationAggregator(new PopulationBaselineProvider(populationCorrelationMapper));
    }

    @Test
    void discardsWeakInsignificantResult() {
        CorrelationCandidate weak = pearson(HealthMetric.SLEEP_HOURS, HealthMetric.SUGAR_G, 0.1, 0.6);

        assertThat(aggregate(List.of(weak), config)).isEmpty();
    }

    @Test
    void bucketsStrengthAndScoresConfidence() {
        CorrelationCandidate strong = pearson(HealthMetric.EXERCISE_MINUTES, HealthMetric.SLEEP_QUALITY, 0.65, 0.01);

        List<Correlation> result = aggregate(List.of(strong), config);

        assertThat(result).hasSize(1);
        Correlation correlation = result.get(0);
        assertThat(correlation.getStrength()).isEqualTo(CorrelationStrength.STRONG);
        assertThat(correlation.getConfidenceScore()).isCloseTo(0.99 * 0.65, within(1e-9));
        assertThat(correlation.getMetricA()).isEqualTo("exercise_minutes");
        assertThat(correlation.getCorrelationType()).isEqualTo(CorrelationType.PEARSON);
        assertThat(correlation.getPeriodStart()).isEqualTo(START);
        assertThat(correlation.getPeriodEnd()).isEqualTo(END);
        assertThat(correlation.getInsight()).isNull();
    }

    @Test
    void agreeingMethodsRaiseConfidence() {
        CorrelationCandidate pearson = pearson(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS, 0.5, 0.01);
        CorrelationCandidate cross = new CorrelationCandidate(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS,
                CorrelationType.CROSS_CORRELATION, 0.55, 0.01, 1, CausalDirection.A_CAUSES_B, null, 59, true);
        CorrelationCandidate mi = new CorrelationCandidate(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS,
                CorrelationType.MUTUAL_INFO, 0.45, 0.01, 0, CausalDirection.NONE, null, 60, true);
        CorrelationCandidate granger = new CorrelationCandidate(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS,
                CorrelationType.GRANGER, -0.4, 0.01, 5, CausalDirection.A_CAUSES_B, 6.2, 54, true);
        List<CorrelationCandidate> group = List.of(pearson, cross, mi, granger);

        assertThat(CorrelationAggregator.countAgreements(pearson, group, 1)).isEqualTo(2);
        assertThat(CorrelationAggregator.countAgreements(cross, group, 1)).isEqualTo(2);
        assertThat(CorrelationAggregator.countAgreements(granger, group, 1)).isZero();

        Correlation stored = aggregate(List.of(pearson, cross), config).stream()
                .filter(c -> c.getCorrelationType() == CorrelationType.PEARSON)
                .findFirst()
                .orElseThrow();
        assertThat(stored.getConfidenceScore()).isCloseTo(0.99 * 0.5 + 0.1, within(1e-9));
    }

    @Test
    void confidenceIsClipped() {
        assertThat(CorrelationAggregator.confidence(0.0, 0.95, 3, 0.1)).isEqualTo(1.0);
        assertThat(CorrelationAggregator.confidence(Double.NaN, 0.5, 0, 0.1)).isEqualTo(0.0);
    }

    @Test
    void unusualValueAgainstNeutralReferenceIsActionable() {
        CorrelationCandidate strong = pearson(HealthMetric.SLEEP_HOURS, HealthMetric.SUGAR_G, 0.65, 0.01);

        Correlation correlation = aggregate(List.of(strong), config).get(0);

        assertThat(correlation.getPopulationAvg()).isEqualTo(0.0);
        assertThat(correlation.getPercentileRank()).isGreaterThan(99.0);
        assertThat(correlation.getIsActionable()).isTrue();
    }

    @Test
    void typicalValueAgainstPopulationIsNotActionable() {
        PopulationCorrelationStat stat = new PopulationCorrelationStat();
        stat.setMetricA("exercise_minutes");
        stat.setMetricB("sleep_quality");
        stat.setCorrelationType(CorrelationType.PEARSON);
        stat.setMeanCorrelation(0.6);
        stat.setStdCorrelation(0.1);
        stat.setUserCount(120);
        when(populationCorrelationMapper.selectByPair(eq("exercise_minutes"), eq("sleep_quality"),
                eq(CorrelationType.PEARSON))).thenReturn(stat);
        CorrelationCandidate strong = pearson(HealthMetric.EXERCISE_MINUTES, HealthMetric.SLEEP_QUALITY, 0.65, 0.01);

        Correlation correlation = aggregate(List.of(strong), config).get(0);

        assertThat(correlation.getPopulationAvg()).isEqualTo(0.6);
        assertThat(correlation.getPercentileRank()).isCloseTo(69.15, within(0.01));
        assertThat(correlation.getIsActionable()).isFalse();
    }

    @Test
    void populationComparisonCanBeDisabled() {
        CorrelationDetectionConfig withoutPopulation = config.toBuilder().includePopulationComparison(false).build();
        CorrelationCandidate strong = pearson(HealthMetric.SLEEP_HOURS, HealthMetric.SUGAR_G, 0.65, 0.01);

        Correlation correlation = aggregate(List.of(strong), withoutPopulation).get(0);

        assertThat(correlation.getIsActionable()).isFalse();
        assertThat(correlation.getPercentileRank()).isNull();
        assertThat(correlation.getPopulationAvg()).isNull();
    }

    @Test
    void enrichmentDoesNotChangeValueOrStrength() {
        when(populationCorrelationMapper.selectByPair(anyString(), anyString(), any())).thenReturn(null);
        CorrelationCandidate strong = pearson(HealthMetric.SLEEP_HOURS, HealthMetric.SUGAR_G, -0.72, 0.001);
        Correlation correlation = aggregate(List.of(strong), config).get(0);
        double percentile = correlation.getPercentileRank();

        CorrelationAggregator.enrich(correlation, new PopulationReference(0.0, 0.25, 0, true), config);

        assertThat(correlation.getCorrelationValue()).isEqualTo(-0.72);
        assertThat(correlation.getStrength()).isEqualTo(CorrelationStrength.VERY_STRONG);
        assertThat(correlation.getPercentileRank()).isEqualTo(percentile);
        assertThat(correlation.getPercentileRank()).isLessThan(1.0);
    }

    @Test
    void ranksByConfidenceThenMagnitude() {
        List<Correlation> ranked = aggregate(List.of(
                pearson(HealthMetric.SLEEP_HOURS, HealthMetric.SUGAR_G, 0.5, 0.01),
                pearson(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS, 0.8, 0.01),
                pearson(HealthMetric.RESTING_HR, HealthMetric.SLEEP_QUALITY, -0.6, 0.01)), config);

        assertThat(ranked).extracting(Correlation::getCorrelationValue).containsExactly(0.8, -0.6, 0.5);
    }

    @Test
    void usesNeutralReferenceForUnknownPair() {
        PopulationBaselineProvider provider = new PopulationBaselineProvider(populationCorrelationMapper);

        PopulationReference reference = provider.referenceFor(HealthMetric.BODY_FAT_PCT, HealthMetric.SPO2,
                CorrelationType.PEARSON, config);

        assertThat(reference).isEqualTo(PopulationBaselineProvider.NEUTRAL);
    }

    @Test
    void smallPopulationFallsBackToDefaults() {
        PopulationCorrelationStat stat = new PopulationCorrelationStat();
        stat.setMeanCorrelation(0.9);
        stat.setStdCorrelation(0.05);
        stat.setUserCount(3);
        when(populationCorrelationMapper.selectByPair(anyString(), anyString(), any())).thenReturn(stat);
        PopulationBaselineProvider provider = new PopulationBaselineProvider(populationCorrelationMapper);

        PopulationReference pearson = provider.referenceFor(HealthMetric.EXERCISE_MINUTES, HealthMetric.RESTING_HR,
                CorrelationType.PEARSON, config);
        PopulationReference mi = provider.referenceFor(HealthMetric.EXERCISE_MINUTES, HealthMetric.RESTING_HR,
                CorrelationType.MUTUAL_INFO, config);

        assertThat(pearson.mean()).isEqualTo(-0.25);
        assertThat(pearson.fallback()).isTrue();
        assertThat(mi.mean()).isEqualTo(0.25);
    }

    private List<Correlation> aggregate(List<CorrelationCandidate> candidates, CorrelationDetectionConfig cfg) {
        return aggregator.aggregate(USER_ID, candidates, START, END, cfg, NOW);
    }

    private static CorrelationCandidate pearson(HealthMetric a, HealthMetric b, double r, double p) {
        return new CorrelationCandidate(a, b, CorrelationType.PEARSON, r, p, 0, CausalDirection.NONE, null, 60,
                p < 0.05);
    }
}
