package com.healthsignal.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.mapper.AnomalyMapper;
import com.healthsignal.mapper.BodyMetricsMapper;
import com.healthsignal.mapper.ChronicMetricsMapper;
import com.healthsignal.mapper.CorrelationMapper;
import com.healthsignal.mapper.ExerciseEntryMapper;
import com.healthsignal.mapper.FoodEntryMapper;
import com.healthsignal.mapper.SleepEntryMapper;
import com.healthsignal.mapper.VitalSignsMapper;
import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.entity.SleepEntry;
import com.healthsignal.model.enums.DetectorType;
import com.healthsignal.model.enums.Severity;
import com.healthsignal.model.vo.AnomalyDetectionVO;
import com.healthsignal.model.vo.AnomalySummaryVO;
import com.healthsignal.service.component.AnalysisRunGuard;
import com.healthsignal.service.detector.AnomalyEnsemble;
import com.healthsignal.service.detector.BaselineCalculator;
import com.healthsignal.service.detector.MultivariateDetector;
import com.healthsignal.service.detector.ZScoreDetector;
import com.healthsignal.service.feature.FeatureMatrixBuilder;
import com.healthsignal.service.manager.AnalysisResultManager;
import com.healthsignal.service.manager.InsightPayloadManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.healthsignal.support.TestHealthDataFactory.USER_ID;
import static com.healthsignal.support.TestHealthDataFactory.sleep;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnomalyDetectionServiceImplTest {

    private static final LocalDate END = LocalDate.of(2024, 3, 31);

    private SleepEntryMapper sleepEntryMapper;
    private AnomalyMapper anomalyMapper;
    private AnalysisRunGuard analysisRunGuard;
    private AnomalyDetectionServiceImpl service;

    /**
     * (日期|指标) -> 已落库记录
     */
    private final Map<String, Anomaly> stored = new HashMap<>();

    @BeforeEach
    void setUp() {
        sleepEntryMapper = mock(SleepEntryMapper.class);
        FeatureMatrixBuilder builder = new FeatureMatrixBuilder(sleepEntryMapper, mock(ExerciseEntryMapper.class),
                mock(FoodEntryMapper.class), mock(VitalSignsMapper.class), mock(BodyMetricsMapper.class),
                mock(ChronicMetricsMapper.class));

        anomalyMapper = mock(AnomalyMapper.class);
        when(anomalyMapper.selectByKey(eq(USER_ID), any(), anyString()))
                .thenAnswer(inv -> stored.get(inv.getArgument(1) + "|" + inv.getArgument(2)));
        doAnswer(inv -> {
            Anomaly anomaly = inv.getArgument(0);
            anomaly.setId((long) stored.size() + 1);
            stored.put(anomaly.getRecordDate() + "|" + anomaly.getMetricName(), anomaly);
            return 1;
        }).when(anomalyMapper).insert(any());

        ObjectMapper objectMapper = new ObjectMapper();
        analysisRunGuard = mock(AnalysisRunGuard.class);
        service = new AnomalyDetectionServiceImpl(builder,
                new ZScoreDetector(new BaselineCalculator()),
                new MultivariateDetector(),
                new AnomalyEnsemble(objectMapper),
                new RuleBasedAnomalyExplanationService(),
                new AnalysisResultManager(anomalyMapper, mock(CorrelationMapper.class)),
                new InsightPayloadManager(objectMapper),
                analysisRunGuard,
                anomalyMapper,
                new AnalysisProperties());
    }

    @Test
    void flagsShortNightAndPersistsItOnce() {
        when(sleepEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any())).thenReturn(sleepHistory());
        AnomalyDetectionConfig config = AnomalyDetectionConfig.defaults().toBuilder()
                .includeExplanation(true).build();

        AnomalyDetectionVO first = service.detect(USER_ID, config, END);

        assertThat(first.getNothingToAnalyze()).isFalse();
        assertThat(first.getNewAnomalies()).isEqualTo(1);
        assertThat(first.getPeriodStart()).isEqualTo(END.minusDays(59));
        Anomaly anomaly = first.getAnomalies().get(0);
        assertThat(anomaly.getMetricName()).isEqualTo("sleep_hours");
        assertThat(anomaly.getRecordDate()).isEqualTo(END.minusDays(10));
        assertThat(anomaly.getDetectorType()).isEqualTo(DetectorType.ZSCORE);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getSourceTable()).isEqualTo("sleep_entries");
        assertThat(anomaly.getExplanation()).contains("睡眠时长").contains("低于");
        assertThat(anomaly.getDetails()).contains("\"match\":\"ZSCORE_ONLY\"");

        AnomalyDetectionVO second = service.detect(USER_ID, config, END);

        assertThat(second.getNewAnomalies()).isZero();
        assertThat(second.getTotalAnomalies()).isEqualTo(first.getTotalAnomalies());
        verify(anomalyMapper, never()).updateDetection(any());
    }

    @Test
    void explanationIsOffByDefault() {
        when(sleepEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any())).thenReturn(sleepHistory());

        AnomalyDetectionVO result = service.detect(USER_ID, AnomalyDetectionConfig.defaults(), END);

        assertThat(result.getAnomalies()).isNotEmpty();
        assertThat(result.getAnomalies()).allSatisfy(a -> assertThat(a.getExplanation()).isNull());
    }

    @Test
    void attributionIsSeparatedFromTemplateText() {
        assertThat(AnomalyDetectionServiceImpl.joinExplanation("睡眠时长 4.0 小时，低于个人基线。",
                "主要偏离指标: sleep_hours"))
                .isEqualTo("睡眠时长 4.0 小时，低于个人基线。 主要偏离指标: sleep_hours");
        assertThat(AnomalyDetectionServiceImpl.joinExplanation("睡眠时长偏低。", null)).isEqualTo("睡眠时长偏低。");
        assertThat(AnomalyDetectionServiceImpl.joinExplanation("睡眠时长偏低。", "  ")).isEqualTo("睡眠时长偏低。");
    }

    @Test
    void emptyWindowReportsNothingToAnalyze() {
        when(analysisRunGuard.runExclusive(eq(USER_ID), anyString(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(2)).get());

        AnomalyDetectionVO result = service.detectAnomalies(USER_ID, null);

        assertThat(result.getNothingToAnalyze()).isTrue();
        assertThat(result.getTotalAnomalies()).isZero();
        assertThat(result.getPeriodEnd()).isEqualTo(LocalDate.now());
        verify(anomalyMapper, never()).insert(any());
    }

    @Test
    void invalidRequestIsRejectedBeforeLocking() {
        AnomalyDetectionDTO request = new AnomalyDetectionDTO();
        request.setContamination(1.0);

        assertThatThrownBy(() -> service.detectAnomalies(USER_ID, request))
                .isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(analysisRunGuard);
    }

    @Test
    void concurrentRunIsRejected() {
        when(analysisRunGuard.runExclusive(eq(USER_ID), anyString(), any()))
                .thenThrow(new IllegalStateException("该用户已有分析任务正在运行，请稍后重试"));

        assertThatThrownBy(() -> service.detectAnomalies(USER_ID, null))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(sleepEntryMapper);
    }

    @Test
    void acknowledgeMarksRowAndRejectsUnknownId() {
        Anomaly existing = new Anomaly();
        existing.setId(3L);
        existing.setIsAcknowledged(false);
        when(anomalyMapper.selectById(USER_ID, 3L)).thenReturn(existing);

        Anomaly acknowledged = service.acknowledgeAnomaly(USER_ID, 3L);

        assertThat(acknowledged.getIsAcknowledged()).isTrue();
        verify(anomalyMapper).acknowledge(USER_ID, 3L);
        assertThatThrownBy(() -> service.acknowledgeAnomaly(USER_ID, 99L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("99");
    }

    @Test
    void summaryAddsUpSeverityCounts() {
        when(anomalyMapper.countBySeverity(eq(USER_ID), any())).thenReturn(List.of(
                Map.of("severity", "HIGH", "cnt", 2L),
                Map.of("severity", "LOW", "cnt", 1L)));
        when(anomalyMapper.countByMetric(eq(USER_ID), any())).thenReturn(List.of(
                Map.of("metricName", "sleep_hours", "cnt", 3L)));
        when(anomalyMapper.countUnacknowledged(eq(USER_ID), any())).thenReturn(2);

        AnomalySummaryVO summary = service.getAnomalySummary(USER_ID, null);

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getUnacknowledged()).isEqualTo(2);
        assertThat(summary.getBySeverity()).containsEntry("HIGH", 2).containsEntry("LOW", 1);
        assertThat(summary.getByMetric()).containsEntry("sleep_hours", 3);
        assertThat(summary.getPeriodDays()).isEqualTo(30);
    }

    @Test
    void queryDefaultsLimit() {
        service.getAnomalies(USER_ID, null, null, null, null);

        verify(anomalyMapper).selectByUser(USER_ID, null, null, null, 100);
    }

    /**
     * 60 晚交替 6.8 / 7.6 小时，倒数第 11 晚只睡 4 小时
     */
    private static List<SleepEntry> sleepHistory() {
        List<SleepEntry> entries = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            double hours = i == 49 ? 4.0 : (i % 2 == 0 ? 6.8 : 7.6);
            entries.add(sleep(END.minusDays(59 - i), hours, null));
        }
        return entries;
    }
}
