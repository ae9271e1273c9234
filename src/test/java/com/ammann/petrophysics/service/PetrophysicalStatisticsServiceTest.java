/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.exception.InsufficientDataException;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.StatisticsSummary;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PetrophysicalStatisticsServiceTest
{

    private static final double M = LogCurve.NULL_VALUE;

    private final PetrophysicalStatisticsService service = new PetrophysicalStatisticsService();

    @Nested
    class Summaries
    {
        @Test
        void smallSampleUsesStudentT()
        {
            StatisticsSummary summary = service.summarize(
                    new double[] {0.1, 0.2, 0.3, 0.4, 0.5}, PropertyType.EFFECTIVE_POROSITY);

            double sd = Math.sqrt(0.025);
            double se = sd / Math.sqrt(5);

            assertThat(summary.mean()).isCloseTo(0.3, within(1e-12));
            assertThat(summary.stdDev()).isCloseTo(sd, within(1e-12));
            assertThat(summary.standardError()).isCloseTo(0.070711, within(1e-6));
            assertThat(summary.confidenceLower()).isCloseTo(0.3 - 2.262 * se, within(1e-12));
            assertThat(summary.confidenceUpper()).isCloseTo(0.3 + 2.262 * se, within(1e-12));
            assertThat(summary.combinedUncertainty())
                    .isCloseTo(Math.sqrt(se * se + 0.025 * 0.025), within(1e-12))
                    .isCloseTo(0.075, within(1e-6));
            assertThat(summary.min()).isEqualTo(0.1);
            assertThat(summary.max()).isEqualTo(0.5);
            assertThat(summary.median()).isEqualTo(0.3);
            assertThat(summary.validCount()).isEqualTo(5);
            assertThat(summary.totalCount()).isEqualTo(5);
            assertThat(summary.dataCompleteness()).isEqualTo(1.0);
            assertThat(summary.confidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(summary.lowConfidence()).isFalse();
        }

        @Test
        void largeSampleUsesNormalQuantile()
        {
            double[] values = new double[40];
            for (int i = 0; i < values.length; i++) {
                values[i] = i % 2 == 0 ? 0.1 : 0.2;
            }

            StatisticsSummary summary = service.summarize(values, PropertyType.SHALE_VOLUME);

            assertThat(summary.confidenceUpper() - summary.mean())
                    .isCloseTo(1.96 * summary.standardError(), within(1e-12));
            assertThat(summary.median()).isCloseTo(0.15, within(1e-12));
        }

        @Test
        void missingSamplesLowerCompletenessButNotStatistics()
        {
            double[] values = {0.1, M, 0.2, Double.NaN, 0.3, M, M, M, M, M};

            StatisticsSummary summary = service.summarize(values, PropertyType.DENSITY_POROSITY);

            assertThat(summary.validCount()).isEqualTo(3);
            assertThat(summary.totalCount()).isEqualTo(10);
            assertThat(summary.mean()).isCloseTo(0.2, within(1e-12));
            assertThat(summary.dataCompleteness()).isCloseTo(0.3, within(1e-12));
            assertThat(summary.confidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        void constantInputHasZeroSpreadAndMethodUncertaintyOnly()
        {
            StatisticsSummary summary = service.summarize(
                    new double[] {0.5, 0.5, 0.5, 0.5}, PropertyType.WATER_SATURATION);

            assertThat(summary.stdDev()).isZero();
            assertThat(summary.confidenceLower()).isEqualTo(summary.mean());
            assertThat(summary.combinedUncertainty()).isCloseTo(0.15, within(1e-12));
        }

        @Test
        void fewerThanThreeValidSamplesGiveLowConfidenceSummary()
        {
            StatisticsSummary summary = service.summarize(
                    new double[] {0.2, 0.3, M, M}, PropertyType.EFFECTIVE_POROSITY);

            assertThat(summary.lowConfidence()).isTrue();
            assertThat(summary.mean()).isZero();
            assertThat(summary.stdDev()).isZero();
            assertThat(summary.combinedUncertainty()).isEqualTo(StatisticsSummary.FALLBACK_UNCERTAINTY);
            assertThat(summary.validCount()).isEqualTo(2);
            assertThat(summary.totalCount()).isEqualTo(4);
            assertThat(summary.confidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        void emptyInputIsLowConfidence()
        {
            StatisticsSummary summary = service.summarize(new double[0], PropertyType.SHALE_VOLUME);

            assertThat(summary.lowConfidence()).isTrue();
            assertThat(summary.dataCompleteness()).isZero();
        }

        @Test
        void summarizesCurveSamples()
        {
            LogCurve curve = new LogCurve("PHIE", "v/v", new double[] {0.1, 0.2, 0.3});

            assertThat(service.summarize(curve, PropertyType.EFFECTIVE_POROSITY).mean())
                    .isCloseTo(0.2, within(1e-12));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "3, 2.262",
            "30, 2.262",
            "31, 1.96"
    })
    void tValueSwitchesAboveThirtySamples(int n, double expected)
    {
        assertThat(PetrophysicalStatisticsService.tValue(n)).isEqualTo(expected);
    }

    @Test
    void requireValidCountPassesAndReturnsCount()
    {
        assertThat(service.requireValidCount(new double[] {0.1, M, 0.2}, 2, "samples")).isEqualTo(2);
    }

    @Test
    void requireValidCountFailsBelowMinimum()
    {
        assertThatThrownBy(() -> service.requireValidCount(new double[] {0.1, M}, 10, "effective porosity samples"))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("effective porosity samples")
                .hasMessageContaining("10");
    }
}
