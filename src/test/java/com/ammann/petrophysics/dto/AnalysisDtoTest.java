/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.IntervalKind;
import com.ammann.petrophysics.enumeration.ReservoirQuality;
import com.ammann.petrophysics.model.Interval;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.service.FieldAnalysisService.FieldAnalysis;
import com.ammann.petrophysics.service.IntervalRankingService;
import com.ammann.petrophysics.service.IntervalSegmentationService;
import com.ammann.petrophysics.service.PetrophysicalStatisticsService;
import com.ammann.petrophysics.service.PorosityCalculatorService;
import com.ammann.petrophysics.service.ShaleVolumeService;
import com.ammann.petrophysics.service.WaterSaturationService;
import com.ammann.petrophysics.service.WellAnalysisService;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysis;
import com.ammann.petrophysics.service.WellAnalysisService.ShaleAnalysis;
import com.ammann.petrophysics.support.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisDtoTest {

    private WellAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new WellAnalysisService(
                new PorosityCalculatorService(),
                new ShaleVolumeService(),
                new WaterSaturationService(),
                new IntervalSegmentationService(),
                new IntervalRankingService(),
                new PetrophysicalStatisticsService(),
                null,
                ParameterSet.defaults());
    }

    @Nested
    @DisplayName("Interval mapping")
    class IntervalMapping {

        @Test
        void copiesEveryField() {
            Interval interval = new Interval(IntervalKind.RESERVOIR, 10.0, 20.0, 10.0, 0.2, 0.25, 11,
                    12.5, 0.9, 0.1, 9.0, "EXCELLENT", 1);

            IntervalDTO dto = IntervalDTO.from(interval);

            assertThat(dto.kind()).isEqualTo(IntervalKind.RESERVOIR);
            assertThat(dto.rank()).isEqualTo(1);
            assertThat(dto.topDepth()).isEqualTo(10.0);
            assertThat(dto.bottomDepth()).isEqualTo(20.0);
            assertThat(dto.pointCount()).isEqualTo(11);
            assertThat(dto.permeabilityEstimate()).isEqualTo(12.5);
            assertThat(dto.netPayPotential()).isEqualTo(9.0);
            assertThat(dto.quality()).isEqualTo("EXCELLENT");
        }

        @Test
        void nullIntervalMapsToNull() {
            assertThat(IntervalDTO.from(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Well analysis mapping")
    class WellAnalysisMapping {

        @Test
        void porosityAnalysisWithoutCurves() {
            PorosityAnalysis analysis = service.analyzePorosity(TestDataFactory.reservoirWell("RES-1"), null);

            PorosityAnalysisDTO dto = PorosityAnalysisDTO.from(analysis, false);

            assertThat(dto.available()).isTrue();
            assertThat(dto.topDepth()).isEqualTo(1000.0);
            assertThat(dto.bottomDepth()).isEqualTo(1059.0);
            assertThat(dto.quality()).isEqualTo(ReservoirQuality.FAIR);
            assertThat(dto.reservoirIntervals()).hasSize(2);
            assertThat(dto.primaryTarget().rank()).isEqualTo(1);
            assertThat(dto.effectivePorosity().mean()).isEqualTo(analysis.effectiveStatistics().mean());
            assertThat(dto.dataQuality().validSamples()).isEqualTo(60);
            assertThat(dto.depths()).isNull();
            assertThat(dto.curves()).isNull();
        }

        @Test
        void porosityAnalysisWithCurves() {
            PorosityAnalysis analysis = service.analyzePorosity(TestDataFactory.reservoirWell("RES-1"), null);

            PorosityAnalysisDTO dto = PorosityAnalysisDTO.from(analysis, true);

            assertThat(dto.depths()).hasSize(60);
            assertThat(dto.curves()).extracting(DerivedCurveDTO::name).containsExactly("PHID", "PHIN", "PHIE");
            assertThat(dto.curves().get(2).values()).hasSize(60);
        }

        @Test
        void unavailableWellHasReasonAndNoCurves() {
            PorosityAnalysisDTO dto = PorosityAnalysisDTO.from(
                    PorosityAnalysis.unavailable("GR-1", "No DENSITY curve"), true);

            assertThat(dto.available()).isFalse();
            assertThat(dto.failureReason()).isEqualTo("No DENSITY curve");
            assertThat(dto.topDepth()).isNull();
            assertThat(dto.curves()).isNull();
            assertThat(dto.reservoirIntervals()).isEmpty();
            assertThat(dto.quality()).isEqualTo(ReservoirQuality.UNKNOWN);
        }

        @Test
        void shaleAnalysisCarriesBaselines() {
            ShaleAnalysis analysis = service.analyzeShale(TestDataFactory.reservoirWell("RES-1"), null);

            ShaleAnalysisDTO dto = ShaleAnalysisDTO.from(analysis, true);

            assertThat(dto.grClean()).isEqualTo(ParameterSet.DEFAULT_GR_CLEAN);
            assertThat(dto.grShale()).isEqualTo(ParameterSet.DEFAULT_GR_SHALE);
            assertThat(dto.cleanSandIntervals()).hasSize(2);
            assertThat(dto.curve().name()).isEqualTo("VSH");
        }

        @Test
        void saturationAnalysisCurvesOnRequest() {
            SaturationAnalysisDTO dto = SaturationAnalysisDTO.from(
                    service.analyzeSaturation(TestDataFactory.reservoirWell("RES-1"), null), true);

            assertThat(dto.curves()).extracting(DerivedCurveDTO::name).containsExactly("PHIE", "SW");
            assertThat(dto.hydrocarbonSaturation()).isGreaterThan(0.0);
        }

        @Test
        void fieldAnalysisOmitsCurves() {
            PorosityAnalysis analysis = service.analyzePorosity(TestDataFactory.reservoirWell("RES-1"), null);
            FieldAnalysis field = new FieldAnalysis(List.of(analysis), 1, 0, "RES-1", analysis.primaryTarget());

            FieldAnalysisDTO dto = FieldAnalysisDTO.from(field);

            assertThat(dto.bestWell()).isEqualTo("RES-1");
            assertThat(dto.bestTarget().topDepth()).isEqualTo(1010.0);
            assertThat(dto.wells()).singleElement().satisfies(w -> assertThat(w.curves()).isNull());
        }
    }
}
