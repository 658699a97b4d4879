package com.healthsignal.model.dto.analysis;

import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.dto.CorrelationDetectionDTO;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnalysisConfigTest {

    @Test
    void anomalyDefaultsComeFromProperties() {
        AnomalyDetectionConfig config = AnomalyDetectionConfig.of(new AnalysisProperties.Anomaly(), null).validate();

        assertThat(config.getDays()).isEqualTo(60);
        assertThat(config.thresholdFor(HealthMetric.TOTAL_CALORIES)).isEqualTo(3.0);
        assertThat(config.thresholdFor(HealthMetric.WEIGHT_KG)).isEqualTo(2.0);
        assertThat(config.thresholdFor(HealthMetric.SLEEP_HOURS)).isEqualTo(2.5);
        assertThat(config.isUseRobust()).isFalse();
        assertThat(config.ewmaAlpha()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void requestOverridesOnlyGivenOptions() {
        AnomalyDetectionDTO request = new AnomalyDetectionDTO();
        request.setDays(30);
        request.setUseRobust(true);
        request.setContamination(0.1);

        AnomalyDetectionConfig config = AnomalyDetectionConfig.of(new AnalysisProperties.Anomaly(), request);

        assertThat(config.getDays()).isEqualTo(30);
        assertThat(config.isUseRobust()).isTrue();
        assertThat(config.isUseAdaptive()).isFalse();
        assertThat(config.getContamination()).isEqualTo(0.1);
    }

    @Test
    void rejectsContaminationOutsideUnitInterval() {
        AnomalyDetectionConfig config = AnomalyDetectionConfig.defaults().toBuilder().contamination(1.0).build();

        assertThatThrownBy(config::validate).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void rejectsUnknownThresholdMetric() {
        AnalysisProperties.Anomaly properties = new AnalysisProperties.Anomaly();
        properties.getThresholds().put("steps", 2.0);

        assertThatThrownBy(() -> AnomalyDetectionConfig.of(properties, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("steps");
    }

    @Test
    void maxLagMapsToGrangerLag() {
        CorrelationDetectionDTO request = new CorrelationDetectionDTO();
        request.setMaxLag(3);
        request.setIncludeMutualInfo(false);

        CorrelationDetectionConfig config = CorrelationDetectionConfig
                .of(new AnalysisProperties.Correlation(), request).validate();

        assertThat(config.getGrangerMaxLag()).isEqualTo(3);
        assertThat(config.getCrossMaxLag()).isEqualTo(14);
        assertThat(config.enabledTypes()).containsExactlyInAnyOrder(CorrelationType.PEARSON,
                CorrelationType.GRANGER, CorrelationType.CROSS_CORRELATION);
    }

    @Test
    void rejectsNonPositiveGrangerLag() {
        CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults().toBuilder().grangerMaxLag(0).build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsRunWithNoMethods() {
        CorrelationDetectionConfig config = CorrelationDetectionConfig.defaults().toBuilder()
                .includePearson(false)
                .includeGranger(false)
                .includeCrossCorrelation(false)
                .includeMutualInfo(false)
                .build();

        assertThatThrownBy(config::validate).isInstanceOf(InvalidConfigurationException.class);
    }
}
