/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.service.FieldAnalysisService.FieldAnalysis;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysis;
import com.ammann.petrophysics.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FieldAnalysisServiceTest
{

    private ExecutorService executor;
    private WellAnalysisService wellAnalysisService;

    @BeforeEach
    void setUp()
    {
        executor = Executors.newFixedThreadPool(2);
        wellAnalysisService = new WellAnalysisService(
                new PorosityCalculatorService(),
                new ShaleVolumeService(),
                new WaterSaturationService(),
                new IntervalSegmentationService(),
                new IntervalRankingService(),
                new PetrophysicalStatisticsService(),
                new SimpleMeterRegistry(),
                ParameterSet.defaults());
    }

    @AfterEach
    void tearDown()
    {
        executor.shutdownNow();
    }

    @Test
    void analyzesEveryWellAndPicksBest()
    {
        FieldAnalysisService service = new FieldAnalysisService(wellAnalysisService, executor);

        FieldAnalysis field = service.analyzeWells(List.of(
                TestDataFactory.tightWell("TIGHT-1"),
                TestDataFactory.reservoirWell("RES-1"),
                TestDataFactory.gammaRayOnlyWell("GR-1")), null);

        assertThat(field.wells()).extracting(PorosityAnalysis::wellName)
                .containsExactly("TIGHT-1", "RES-1", "GR-1");
        assertThat(field.wells()).extracting(PorosityAnalysis::available)
                .containsExactly(true, true, false);
        assertThat(field.wellsAnalyzed()).isEqualTo(2);
        assertThat(field.wellsUnavailable()).isEqualTo(1);
        assertThat(field.bestWell()).isEqualTo("RES-1");
        assertThat(field.bestTarget().topDepth()).isEqualTo(1010.0);
    }

    @Test
    void noTargetsMeansNoBestWell()
    {
        FieldAnalysisService service = new FieldAnalysisService(wellAnalysisService, executor);

        FieldAnalysis field = service.analyzeWells(List.of(TestDataFactory.tightWell("TIGHT-1")), null);

        assertThat(field.wellsAnalyzed()).isEqualTo(1);
        assertThat(field.bestWell()).isNull();
        assertThat(field.bestTarget()).isNull();
    }

    @Test
    void emptyFieldIsEmptyResult()
    {
        FieldAnalysisService service = new FieldAnalysisService(wellAnalysisService, executor);

        FieldAnalysis field = service.analyzeWells(List.of(), null);

        assertThat(field.wells()).isEmpty();
        assertThat(field.wellsAnalyzed()).isZero();
    }

    @Test
    void unexpectedTaskFailureMarksOnlyThatWellUnavailable()
    {
        WellLogDataset good = TestDataFactory.reservoirWell("RES-1");
        WellLogDataset broken = TestDataFactory.tightWell("BROKEN-1");
        WellAnalysisService mocked = mock(WellAnalysisService.class);
        PorosityAnalysis goodResult = wellAnalysisService.analyzePorositySafely(good, null);
        when(mocked.analyzePorositySafely(eq(good), any())).thenReturn(goodResult);
        when(mocked.analyzePorositySafely(eq(broken), any())).thenThrow(new IllegalStateException("boom"));

        FieldAnalysis field = new FieldAnalysisService(mocked, executor).analyzeWells(List.of(broken, good), null);

        assertThat(field.wells().get(0).available()).isFalse();
        assertThat(field.wells().get(0).failureReason()).contains("boom");
        assertThat(field.wells().get(1)).isSameAs(goodResult);
        assertThat(field.bestWell()).isEqualTo("RES-1");
    }
}
