/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.IntervalKind;
import com.ammann.petrophysics.enumeration.RankingCriterion;
import com.ammann.petrophysics.model.Interval;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalRankingServiceTest
{

    private final IntervalRankingService service = new IntervalRankingService();

    private static Interval interval(IntervalKind kind, double top, double thickness, double mean, double shale)
    {
        return new Interval(kind, top, top + thickness, thickness, mean, mean, (int) thickness + 1,
                null, null, shale, thickness * (1.0 - shale), null, 0);
    }

    @ParameterizedTest
    @CsvSource({
            "RESERVOIR, 0.20, EXCELLENT",
            "RESERVOIR, 0.18, EXCELLENT",
            "RESERVOIR, 0.13, GOOD",
            "RESERVOIR, 0.09, FAIR",
            "RESERVOIR, 0.05, POOR",
            "HIGH_POROSITY, 0.22, EXCEPTIONAL",
            "HIGH_POROSITY, 0.16, EXCELLENT",
            "HIGH_POROSITY, 0.12, VERY_GOOD",
            "HIGH_POROSITY, 0.11, GOOD",
            "CLEAN_SAND, 0.15, EXCELLENT",
            "CLEAN_SAND, 0.25, GOOD",
            "CLEAN_SAND, 0.40, FAIR",
            "CLEAN_SAND, 0.60, POOR"
    })
    void classifiesByKind(IntervalKind kind, double mean, String expected)
    {
        assertThat(service.classify(interval(kind, 0.0, 5.0, mean, 0.0))).isEqualTo(expected);
    }

    @Test
    void ranksByValueTimesThickness()
    {
        Interval thinRich = interval(IntervalKind.RESERVOIR, 100.0, 4.0, 0.20, 0.0);     // 0.8
        Interval thickLean = interval(IntervalKind.RESERVOIR, 200.0, 10.0, 0.10, 0.0);   // 1.0
        Interval small = interval(IntervalKind.RESERVOIR, 300.0, 4.0, 0.09, 0.0);        // 0.36

        List<Interval> ranked = service.rank(List.of(thinRich, thickLean, small), RankingCriterion.VALUE_THICKNESS);

        assertThat(ranked).extracting(Interval::topDepth).containsExactly(200.0, 100.0, 300.0);
        assertThat(ranked).extracting(Interval::rank).containsExactly(1, 2, 3);
    }

    @Test
    void ranksCleanSandByNetPay()
    {
        Interval shaly = interval(IntervalKind.CLEAN_SAND, 0.0, 10.0, 0.28, 0.28);  // 7.2
        Interval clean = interval(IntervalKind.CLEAN_SAND, 20.0, 8.0, 0.05, 0.05);  // 7.6

        List<Interval> ranked = service.rank(List.of(shaly, clean), RankingCriterion.NET_PAY_POTENTIAL);

        assertThat(ranked.get(0).topDepth()).isEqualTo(20.0);
    }

    @Test
    void tiesKeepDepthOrder()
    {
        Interval upper = interval(IntervalKind.HIGH_POROSITY, 10.0, 2.0, 0.15, 0.0);
        Interval lower = interval(IntervalKind.HIGH_POROSITY, 50.0, 6.0, 0.15, 0.0);

        List<Interval> ranked = service.rank(List.of(upper, lower), RankingCriterion.MEAN_VALUE);

        assertThat(ranked).extracting(Interval::topDepth).containsExactly(10.0, 50.0);
    }

    @Test
    void doesNotModifyInput()
    {
        List<Interval> input = new ArrayList<>(List.of(
                interval(IntervalKind.RESERVOIR, 0.0, 4.0, 0.09, 0.0),
                interval(IntervalKind.RESERVOIR, 10.0, 4.0, 0.20, 0.0)));

        service.rank(input, RankingCriterion.VALUE_THICKNESS);

        assertThat(input).extracting(Interval::topDepth).containsExactly(0.0, 10.0);
        assertThat(input).extracting(Interval::rank).containsOnly(0);
    }

    @Test
    void classifyAndRankUsesKindDefaultAndFindsPrimaryTarget()
    {
        List<Interval> ranked = service.classifyAndRank(List.of(
                interval(IntervalKind.RESERVOIR, 0.0, 4.0, 0.09, 0.0),
                interval(IntervalKind.RESERVOIR, 10.0, 4.0, 0.20, 0.0)));

        assertThat(ranked.get(0).qualityLabel()).isEqualTo("EXCELLENT");
        assertThat(ranked.get(1).qualityLabel()).isEqualTo("FAIR");
        assertThat(service.primaryTarget(ranked)).hasValueSatisfying(
                target -> assertThat(target.topDepth()).isEqualTo(10.0));
    }

    @Test
    void emptySetHasNoPrimaryTarget()
    {
        assertThat(service.classifyAndRank(List.of())).isEmpty();
        assertThat(service.primaryTarget(List.of())).isEmpty();
    }
}
