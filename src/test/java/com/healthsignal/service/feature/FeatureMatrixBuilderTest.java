package com.healthsignal.service.feature;

import com.healthsignal.exception.EmptyFeatureMatrixException;
import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.mapper.BodyMetricsMapper;
import com.healthsignal.mapper.ChronicMetricsMapper;
import com.healthsignal.mapper.ExerciseEntryMapper;
import com.healthsignal.mapper.FoodEntryMapper;
import com.healthsignal.mapper.SleepEntryMapper;
import com.healthsignal.mapper.VitalSignsMapper;
import com.healthsignal.model.dto.analysis.DailyFeatureVector;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.enums.ChronicTimeOfDay;
import com.healthsignal.model.enums.ExerciseIntensity;
import com.healthsignal.model.enums.HealthMetric;
import com.healthsignal.model.enums.TimeOfDay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.healthsignal.support.TestHealthDataFactory.USER_ID;
import static com.healthsignal.support.TestHealthDataFactory.body;
import static com.healthsignal.support.TestHealthDataFactory.exercise;
import static com.healthsignal.support.TestHealthDataFactory.food;
import static com.healthsignal.support.TestHealthDataFactory.glucose;
import static com.healthsignal.support.TestHealthDataFactory.sleep;
import static com.healthsignal.support.TestHealthDataFactory.vitals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FeatureMatrixBuilderTest {

    private static final LocalDate END = LocalDate.of(2024, 3, 31);

    private SleepEntryMapper sleepEntryMapper;
    private ExerciseEntryMapper exerciseEntryMapper;
    private FoodEntryMapper foodEntryMapper;
    private VitalSignsMapper vitalSignsMapper;
    private BodyMetricsMapper bodyMetricsMapper;
    private ChronicMetricsMapper chronicMetricsMapper;
    private FeatureMatrixBuilder builder;

    @BeforeEach
    void setUp() {
        sleepEntryMapper = mock(SleepEntryMapper.class);
        exerciseEntryMapper = mock(ExerciseEntryMapper.class);
        foodEntryMapper = mock(FoodEntryMapper.class);
        vitalSignsMapper = mock(VitalSignsMapper.class);
        bodyMetricsMapper = mock(BodyMetricsMapper.class);
        chronicMetricsMapper = mock(ChronicMetricsMapper.class);
        builder = new FeatureMatrixBuilder(sleepEntryMapper, exerciseEntryMapper, foodEntryMapper,
                vitalSignsMapper, bodyMetricsMapper, chronicMetricsMapper);
    }

    @Test
    void sumsNapsIntoSleepHoursAndWeightsQualityByDuration() {
        when(sleepEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(sleep(END, 7.0, 8), sleep(END, 1.0, 4)));

        DailyFeatureVector day = lastRow(builder.build(USER_ID, END, 5));

        assertThat(day.get(HealthMetric.SLEEP_HOURS)).isCloseTo(8.0, within(1e-9));
        assertThat(day.get(HealthMetric.SLEEP_QUALITY)).isCloseTo(7.5, within(1e-9));
        assertThat(day.get(HealthMetric.AWAKENINGS)).isEqualTo(2.0);
    }

    @Test
    void averagesExerciseIntensityScores() {
        when(exerciseEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(exercise(END, 30, ExerciseIntensity.LOW, 120),
                        exercise(END, 20, ExerciseIntensity.HIGH, 200)));

        DailyFeatureVector day = lastRow(builder.build(USER_ID, END, 5));

        assertThat(day.get(HealthMetric.EXERCISE_MINUTES)).isEqualTo(50.0);
        assertThat(day.get(HealthMetric.EXERCISE_CALORIES)).isCloseTo(320.0, within(1e-9));
        assertThat(day.get(HealthMetric.EXERCISE_INTENSITY_AVG)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void takesFirstVitalsReadingByTimeOfDayAndDerivesMeanPressure() {
        when(vitalSignsMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(vitals(1L, END, TimeOfDay.EVENING, 80, 135, 88),
                        vitals(2L, END, TimeOfDay.MORNING, 60, 120, 80)));

        DailyFeatureVector day = lastRow(builder.build(USER_ID, END, 5));

        assertThat(day.get(HealthMetric.RESTING_HR)).isEqualTo(60.0);
        assertThat(day.get(HealthMetric.BP_MEAN)).isCloseTo((120 + 2 * 80) / 3.0, within(1e-9));
    }

    @Test
    void derivesProteinRatioOnlyWhenCaloriesArePositive() {
        when(foodEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(food(END, 1500, 60), food(END, 500, 40), food(END.minusDays(1), 0, 10)));

        FeatureMatrix matrix = builder.build(USER_ID, END, 5);

        assertThat(lastRow(matrix).get(HealthMetric.PROTEIN_RATIO)).isCloseTo(0.2, within(1e-9));
        assertThat(matrix.row(matrix.size() - 2).has(HealthMetric.PROTEIN_RATIO)).isFalse();
    }

    @Test
    void weightChangeUsesReadingFromBeforeTheWindow() {
        when(bodyMetricsMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(body(END.minusDays(8), 70.0), body(END, 71.5)));

        FeatureMatrix matrix = builder.build(USER_ID, END, 3);

        assertThat(matrix.size()).isEqualTo(3);
        assertThat(lastRow(matrix).get(HealthMetric.WEIGHT_CHANGE_7D)).isCloseTo(1.5, within(1e-9));
        // 体重不向后填充
        assertThat(matrix.row(0).has(HealthMetric.WEIGHT_KG)).isFalse();
    }

    @Test
    void prefersFastingGlucoseAndKeepsFirstPostMealReading() {
        when(chronicMetricsMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(
                        glucose(END, ChronicTimeOfDay.POST_MEAL, 150, END.atTime(13, 0)),
                        glucose(END, ChronicTimeOfDay.FASTING, 95, END.atTime(7, 0)),
                        glucose(END, ChronicTimeOfDay.POST_MEAL, 170, END.atTime(19, 0)),
                        glucose(END.minusDays(1), ChronicTimeOfDay.OTHER, 100, END.minusDays(1).atTime(9, 0)),
                        glucose(END.minusDays(1), ChronicTimeOfDay.BEDTIME, 120, END.minusDays(1).atTime(22, 0))));

        FeatureMatrix matrix = builder.build(USER_ID, END, 5);
        DailyFeatureVector day = lastRow(matrix);

        assertThat(day.get(HealthMetric.GLUCOSE_MGDL)).isEqualTo(95.0);
        assertThat(day.get(HealthMetric.GLUCOSE_POST_MEAL_MGDL)).isEqualTo(150.0);
        assertThat(matrix.row(matrix.size() - 2).get(HealthMetric.GLUCOSE_MGDL)).isCloseTo(110.0, within(1e-9));
        // 两天只有两个读数，不足以计算波动
        assertThat(day.has(HealthMetric.GLUCOSE_VARIABILITY)).isFalse();
    }

    @Test
    void rollingAverageAndDeviationStayInsideTheWindow() {
        when(sleepEntryMapper.selectByUserIdAndDateRange(eq(USER_ID), any(), any()))
                .thenReturn(List.of(sleep(END.minusDays(10), 20.0, 7), sleep(END.minusDays(8), 6.0, 7),
                        sleep(END.minusDays(6), 7.0, 7), sleep(END.minusDays(2), 8.0, 7), sleep(END, 6.0, 7)));

        FeatureMatrix matrix = builder.build(USER_ID, END, 10);
        DailyFeatureVector day = lastRow(matrix);

        assertThat(day.get(HealthMetric.SLEEP_HOURS_7D_AVG)).isCloseTo(7.0, within(1e-9));
        assertThat(day.get(HealthMetric.SLEEP_HOURS_DEVIATION)).isCloseTo(-1.0, within(1e-9));
        // 当天缺测：有均值、无偏离
        DailyFeatureVector previous = matrix.row(matrix.size() - 2);
        assertThat(previous.get(HealthMetric.SLEEP_HOURS_7D_AVG)).isCloseTo(7.5, within(1e-9));
        assertThat(previous.has(HealthMetric.SLEEP_HOURS_DEVIATION)).isFalse();
        // 窗口之前的 20 小时不参与
        assertThat(matrix.row(0).has(HealthMetric.SLEEP_HOURS_7D_AVG)).isFalse();
        assertThat(matrix.row(1).get(HealthMetric.SLEEP_HOURS_7D_AVG)).isCloseTo(6.0, within(1e-9));
        assertThat(matrix.row(1).get(HealthMetric.SLEEP_HOURS_DEVIATION)).isCloseTo(0.0, within(1e-9));
        assertThat(day.has(HealthMetric.TOTAL_CALORIES_7D_AVG)).isFalse();
    }

    @Test
    void emptyWindowIsReportedAsEmptyMatrix() {
        FeatureMatrix matrix = builder.build(USER_ID, END, 30);

        assertThat(matrix.size()).isEqualTo(30);
        assertThat(matrix.isEmpty()).isTrue();
        assertThatThrownBy(matrix::requireData).isInstanceOf(EmptyFeatureMatrixException.class);
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> builder.build(USER_ID, END, 0))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    private static DailyFeatureVector lastRow(FeatureMatrix matrix) {
        return matrix.row(matrix.size() - 1);
    }
}
