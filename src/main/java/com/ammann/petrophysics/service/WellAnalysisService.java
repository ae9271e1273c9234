/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.enumeration.CurveAlias;
import com.ammann.petrophysics.enumeration.Lithology;
import com.ammann.petrophysics.enumeration.PorosityBlendMethod;
import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.enumeration.RankingCriterion;
import com.ammann.petrophysics.enumeration.ReservoirQuality;
import com.ammann.petrophysics.enumeration.ShaleVolumeMethod;
import com.ammann.petrophysics.exception.ApiException;
import com.ammann.petrophysics.exception.InsufficientDataException;
import com.ammann.petrophysics.model.DepthAxis;
import com.ammann.petrophysics.model.DerivedCurve;
import com.ammann.petrophysics.model.Interval;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.model.SegmentationRule;
import com.ammann.petrophysics.model.StatisticsSummary;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.service.ShaleVolumeService.GammaRayBaselines;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Runs the full porosity, shale and saturation workflows for one well.
 *
 * <p>Each workflow filters the dataset to the requested depth range, derives the
 * property curves, summarizes them, segments and ranks intervals and grades the well.
 * Missing curves and too few valid samples surface as {@link ApiException}s; the
 * {@code *Safely} variants turn those into an unavailable result for callers that
 * must keep going, such as multi-well analysis.
 *
 * <p>Options left {@code null} fall back to the configured defaults.
 */
@ApplicationScoped
public class WellAnalysisService
{

    private static final Logger LOG = Logger.getLogger(WellAnalysisService.class);

    static final int MIN_VALID_SAMPLES = 10;
    static final String METRIC_NAME = "petrophysics_well_analyses_total";

    static final String ANALYSIS_POROSITY = "porosity";
    static final String ANALYSIS_SHALE = "shale";
    static final String ANALYSIS_SATURATION = "saturation";

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_FAILURE = "failure";

    @ConfigProperty(name = "petrophysics.porosity.cutoff", defaultValue = "0.08")
    double porosityCutoff = SegmentationRule.DEFAULT_RESERVOIR_CUTOFF;

    @ConfigProperty(name = "petrophysics.porosity.high-cutoff", defaultValue = "0.12")
    double highPorosityCutoff = SegmentationRule.DEFAULT_HIGH_POROSITY_CUTOFF;

    @ConfigProperty(name = "petrophysics.porosity.blend", defaultValue = "GEOMETRIC")
    PorosityBlendMethod blendMethod = PorosityBlendMethod.GEOMETRIC;

    @ConfigProperty(name = "petrophysics.lithology", defaultValue = "SANDSTONE")
    Lithology lithology = Lithology.SANDSTONE;

    @ConfigProperty(name = "petrophysics.shale.cutoff", defaultValue = "0.30")
    double shaleCutoff = SegmentationRule.DEFAULT_CLEAN_SAND_CUTOFF;

    @ConfigProperty(name = "petrophysics.shale.method", defaultValue = "LARIONOV_TERTIARY")
    ShaleVolumeMethod shaleMethod = ShaleVolumeMethod.LARIONOV_TERTIARY;

    private final PorosityCalculatorService porosityCalculator;
    private final ShaleVolumeService shaleVolumeService;
    private final WaterSaturationService waterSaturationService;
    private final IntervalSegmentationService segmentationService;
    private final IntervalRankingService rankingService;
    private final PetrophysicalStatisticsService statisticsService;
    private final MeterRegistry meterRegistry;
    private final ParameterSet defaultParameters;

    @Inject
    public WellAnalysisService(PorosityCalculatorService porosityCalculator,
                               ShaleVolumeService shaleVolumeService,
                               WaterSaturationService waterSaturationService,
                               IntervalSegmentationService segmentationService,
                               IntervalRankingService rankingService,
                               PetrophysicalStatisticsService statisticsService,
                               MeterRegistry meterRegistry,
                               ParameterSet defaultParameters)
    {
        this.porosityCalculator = porosityCalculator;
        this.shaleVolumeService = shaleVolumeService;
        this.waterSaturationService = waterSaturationService;
        this.segmentationService = segmentationService;
        this.rankingService = rankingService;
        this.statisticsService = statisticsService;
        this.meterRegistry = meterRegistry;
        this.defaultParameters = defaultParameters == null ? ParameterSet.defaults() : defaultParameters;
    }

    /**
     * Porosity workflow: density, neutron and effective porosity, their statistics,
     * ranked reservoir intervals and high-porosity zones, and an overall grade.
     *
     * @throws com.ammann.petrophysics.exception.CurveNotFoundException if density or neutron is absent
     * @throws InsufficientDataException if fewer than ten density or neutron porosity samples are valid
     */
    public PorosityAnalysis analyzePorosity(WellLogDataset dataset, PorosityAnalysisOptions options)
    {
        PorosityAnalysisOptions opts = options == null ? PorosityAnalysisOptions.defaults() : options;
        try {
            WellLogDataset well = applyDepthRange(dataset, opts.depthStart(), opts.depthEnd());
            ParameterSet params = opts.parameters() == null ? defaultParameters : opts.parameters();
            Lithology lith = opts.lithology() == null ? lithology : opts.lithology();
            PorosityBlendMethod blend = opts.blendMethod() == null ? blendMethod : opts.blendMethod();

            DerivedCurve densityPorosity = porosityCalculator.densityPorosity(well.resolve(CurveAlias.DENSITY), params);
            DerivedCurve neutronPorosity = porosityCalculator.neutronPorosity(well.resolve(CurveAlias.NEUTRON), lith);
            statisticsService.requireValidCount(densityPorosity.samples(), MIN_VALID_SAMPLES,
                    "valid density porosity samples");
            statisticsService.requireValidCount(neutronPorosity.samples(), MIN_VALID_SAMPLES,
                    "valid neutron porosity samples");

            DerivedCurve shaleVolume = null;
            if (opts.shaleCorrection() && well.has(CurveAlias.GAMMA_RAY)) {
                shaleVolume = shaleVolumeService.shaleVolume(well.resolve(CurveAlias.GAMMA_RAY), params, shaleMethod);
            }
            DerivedCurve effectivePorosity =
                    porosityCalculator.effectivePorosity(densityPorosity, neutronPorosity, shaleVolume, blend);

            StatisticsSummary densityStats = statisticsService.summarize(densityPorosity, PropertyType.DENSITY_POROSITY);
            StatisticsSummary neutronStats = statisticsService.summarize(neutronPorosity, PropertyType.NEUTRON_POROSITY);
            StatisticsSummary effectiveStats =
                    statisticsService.summarize(effectivePorosity, PropertyType.EFFECTIVE_POROSITY);

            double reservoirCutoff = opts.porosityCutoff() == null ? porosityCutoff : opts.porosityCutoff();
            double zoneCutoff = opts.highPorosityCutoff() == null ? highPorosityCutoff : opts.highPorosityCutoff();

            List<Interval> reservoirs = segmentAndRank(well, effectivePorosity, shaleVolume,
                    SegmentationRule.reservoir(reservoirCutoff));
            List<Interval> zones = segmentAndRank(well, effectivePorosity, shaleVolume,
                    SegmentationRule.highPorosity(zoneCutoff));
            Interval primaryTarget = rankingService.primaryTarget(reservoirs).orElse(null);

            ReservoirQuality quality = effectiveStats.lowConfidence()
                    ? ReservoirQuality.POOR
                    : ReservoirQuality.fromPorosity(effectiveStats.mean(), reservoirs.size(), zones.size());

            PorosityAnalysis analysis = new PorosityAnalysis(
                    well.getWellName(), true, null, well.getDepthAxis(),
                    densityPorosity, neutronPorosity, effectivePorosity,
                    densityStats, neutronStats, effectiveStats,
                    reservoirs, zones, primaryTarget, quality,
                    DataQuality.of(effectiveStats.validCount(), effectiveStats.totalCount()));

            LOG.infof("Porosity analysis of %s: mean phiE=%.3f, %d reservoir intervals, %d high-porosity zones, quality %s",
                    well.getWellName(), effectiveStats.mean(), reservoirs.size(), zones.size(), quality);
            record(ANALYSIS_POROSITY, OUTCOME_SUCCESS);
            return analysis;
        } catch (ApiException e) {
            record(ANALYSIS_POROSITY, OUTCOME_FAILURE);
            throw e;
        }
    }

    /**
     * Porosity workflow that reports failures in the result instead of throwing.
     */
    public PorosityAnalysis analyzePorositySafely(WellLogDataset dataset, PorosityAnalysisOptions options)
    {
        try {
            return analyzePorosity(dataset, options);
        } catch (ApiException e) {
            LOG.warnf("Porosity analysis of %s unavailable: %s", dataset.getWellName(), e.getMessage());
            return PorosityAnalysis.unavailable(dataset.getWellName(), e.getMessage());
        }
    }

    /**
     * Shale workflow: shale volume from gamma ray, its statistics, sample net-to-gross,
     * ranked clean-sand intervals and an overall grade.
     *
     * @throws com.ammann.petrophysics.exception.CurveNotFoundException if gamma ray is absent
     * @throws InsufficientDataException if fewer than ten gamma-ray samples are valid
     */
    public ShaleAnalysis analyzeShale(WellLogDataset dataset, ShaleAnalysisOptions options)
    {
        ShaleAnalysisOptions opts = options == null ? ShaleAnalysisOptions.defaults() : options;
        try {
            WellLogDataset well = applyDepthRange(dataset, opts.depthStart(), opts.depthEnd());
            ParameterSet params = opts.parameters() == null ? defaultParameters : opts.parameters();
            ShaleVolumeMethod method = opts.method() == null ? shaleMethod : opts.method();
            double cutoff = opts.shaleCutoff() == null ? shaleCutoff : opts.shaleCutoff();

            LogCurve gammaRay = well.resolve(CurveAlias.GAMMA_RAY);
            statisticsService.requireValidCount(gammaRay.samples(), MIN_VALID_SAMPLES, "valid gamma-ray samples");

            GammaRayBaselines baselines = opts.autoBaselines()
                    ? shaleVolumeService.estimateBaselines(gammaRay)
                    : GammaRayBaselines.of(params);

            DerivedCurve shaleVolume = shaleVolumeService.shaleVolume(gammaRay, baselines, method);
            StatisticsSummary stats = statisticsService.summarize(shaleVolume, PropertyType.SHALE_VOLUME);
            double netToGross = sampleNetToGross(shaleVolume.samples(), cutoff);

            List<Interval> cleanSands = segmentAndRank(well, shaleVolume, null, SegmentationRule.cleanSand(cutoff));
            Interval primaryTarget = rankingService.primaryTarget(cleanSands).orElse(null);

            ReservoirQuality quality = stats.lowConfidence()
                    ? ReservoirQuality.POOR
                    : ReservoirQuality.fromShale(stats.mean(), netToGross, cleanSands.size());

            ShaleAnalysis analysis = new ShaleAnalysis(
                    well.getWellName(), true, null, well.getDepthAxis(), method, baselines,
                    shaleVolume, stats, netToGross, cleanSands, primaryTarget, quality,
                    DataQuality.of(stats.validCount(), stats.totalCount()));

            LOG.infof("Shale analysis of %s: mean Vsh=%.3f, net-to-gross=%.2f, %d clean sands, quality %s",
                    well.getWellName(), stats.mean(), netToGross, cleanSands.size(), quality);
            record(ANALYSIS_SHALE, OUTCOME_SUCCESS);
            return analysis;
        } catch (ApiException e) {
            record(ANALYSIS_SHALE, OUTCOME_FAILURE);
            throw e;
        }
    }

    /**
     * Shale workflow that reports failures in the result instead of throwing.
     */
    public ShaleAnalysis analyzeShaleSafely(WellLogDataset dataset, ShaleAnalysisOptions options)
    {
        try {
            return analyzeShale(dataset, options);
        } catch (ApiException e) {
            LOG.warnf("Shale analysis of %s unavailable: %s", dataset.getWellName(), e.getMessage());
            return ShaleAnalysis.unavailable(dataset.getWellName(), e.getMessage());
        }
    }

    /**
     * Saturation workflow: Archie water saturation from resistivity and effective
     * porosity, its statistics and the mean hydrocarbon saturation.
     *
     * @throws com.ammann.petrophysics.exception.CurveNotFoundException if resistivity, density or neutron is absent
     * @throws InsufficientDataException if fewer than ten water saturation samples are valid
     */
    public SaturationAnalysis analyzeSaturation(WellLogDataset dataset, SaturationAnalysisOptions options)
    {
        SaturationAnalysisOptions opts = options == null ? SaturationAnalysisOptions.defaults() : options;
        try {
            WellLogDataset well = applyDepthRange(dataset, opts.depthStart(), opts.depthEnd());
            ParameterSet params = opts.parameters() == null ? defaultParameters : opts.parameters();
            Lithology lith = opts.lithology() == null ? lithology : opts.lithology();
            PorosityBlendMethod blend = opts.blendMethod() == null ? blendMethod : opts.blendMethod();

            LogCurve resistivity = well.resolve(CurveAlias.RESISTIVITY);
            DerivedCurve densityPorosity = porosityCalculator.densityPorosity(well.resolve(CurveAlias.DENSITY), params);
            DerivedCurve neutronPorosity = porosityCalculator.neutronPorosity(well.resolve(CurveAlias.NEUTRON), lith);
            DerivedCurve effectivePorosity =
                    porosityCalculator.effectivePorosity(densityPorosity, neutronPorosity, null, blend);

            DerivedCurve waterSaturation = waterSaturationService.archie(resistivity, effectivePorosity, params);
            statisticsService.requireValidCount(waterSaturation.samples(), MIN_VALID_SAMPLES,
                    "valid water saturation samples");

            StatisticsSummary stats = statisticsService.summarize(waterSaturation, PropertyType.WATER_SATURATION);
            double hydrocarbonSaturation = 1.0 - stats.mean();

            SaturationAnalysis analysis = new SaturationAnalysis(
                    well.getWellName(), well.getDepthAxis(), effectivePorosity, waterSaturation,
                    stats, hydrocarbonSaturation,
                    DataQuality.of(stats.validCount(), stats.totalCount()));

            LOG.infof("Saturation analysis of %s: mean Sw=%.3f, Sh=%.3f",
                    well.getWellName(), stats.mean(), hydrocarbonSaturation);
            record(ANALYSIS_SATURATION, OUTCOME_SUCCESS);
            return analysis;
        } catch (ApiException e) {
            record(ANALYSIS_SATURATION, OUTCOME_FAILURE);
            throw e;
        }
    }

    /**
     * Fraction of valid shale volume samples at or below {@code cutoff}, 0 when none are valid.
     */
    static double sampleNetToGross(double[] shaleVolume, double cutoff)
    {
        int valid = 0;
        int net = 0;
        for (double v : shaleVolume) {
            if (!LogCurve.isMissing(v)) {
                valid++;
                if (v <= cutoff) {
                    net++;
                }
            }
        }
        return valid == 0 ? 0.0 : (double) net / valid;
    }

    private List<Interval> segmentAndRank(WellLogDataset well, LogCurve curve, LogCurve shaleVolume,
                                          SegmentationRule rule)
    {
        List<Interval> intervals = segmentationService.segment(well.getDepthAxis(), curve, rule, shaleVolume);
        return rankingService.rank(rankingService.classifyAll(intervals), RankingCriterion.defaultFor(rule.kind()));
    }

    private static WellLogDataset applyDepthRange(WellLogDataset dataset, Double start, Double end)
    {
        if (start == null && end == null) {
            return dataset;
        }
        if (dataset.getDepthAxis().isEmpty()) {
            return dataset;
        }
        double from = start == null ? dataset.getDepthAxis().top() : start;
        double to = end == null ? dataset.getDepthAxis().bottom() : end;
        return dataset.filterByDepthRange(from, to);
    }

    private void record(String analysis, String outcome)
    {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder(METRIC_NAME)
                .description("Count of well analyses by type and outcome")
                .tag("analysis", analysis)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Options for the porosity workflow. {@code null} fields use the configured defaults.
     *
     * @param depthStart         top of the analysed range, dataset top when {@code null}
     * @param depthEnd           bottom of the analysed range, dataset bottom when {@code null}
     * @param lithology          neutron lithology correction
     * @param blendMethod        effective porosity blend
     * @param porosityCutoff     reservoir interval cutoff
     * @param highPorosityCutoff high-porosity zone cutoff
     * @param shaleCorrection    subtract a gamma-ray shale correction when a GR curve exists
     * @param parameters         physical constants
     */
    public record PorosityAnalysisOptions(
            Double depthStart,
            Double depthEnd,
            Lithology lithology,
            PorosityBlendMethod blendMethod,
            Double porosityCutoff,
            Double highPorosityCutoff,
            boolean shaleCorrection,
            ParameterSet parameters
    ) {
        public static PorosityAnalysisOptions defaults() {
            return new PorosityAnalysisOptions(null, null, null, null, null, null, false, null);
        }
    }

    /**
     * Options for the shale workflow. {@code null} fields use the configured defaults.
     *
     * @param autoBaselines estimate GR clean and shale baselines from the log
     */
    public record ShaleAnalysisOptions(
            Double depthStart,
            Double depthEnd,
            ShaleVolumeMethod method,
            Double shaleCutoff,
            boolean autoBaselines,
            ParameterSet parameters
    ) {
        public static ShaleAnalysisOptions defaults() {
            return new ShaleAnalysisOptions(null, null, null, null, false, null);
        }
    }

    public record SaturationAnalysisOptions(
            Double depthStart,
            Double depthEnd,
            Lithology lithology,
            PorosityBlendMethod blendMethod,
            ParameterSet parameters
    ) {
        public static SaturationAnalysisOptions defaults() {
            return new SaturationAnalysisOptions(null, null, null, null, null);
        }
    }

    /**
     * Completeness of the property the analysis was graded on.
     */
    public record DataQuality(double completeness, int validSamples, int totalSamples, ConfidenceLevel confidence) {

        static DataQuality of(int validSamples, int totalSamples) {
            double completeness = totalSamples == 0 ? 0.0 : (double) validSamples / totalSamples;
            return new DataQuality(completeness, validSamples, totalSamples,
                    ConfidenceLevel.fromCompleteness(completeness));
        }
    }

    /**
     * Result of the porosity workflow. When {@code available} is {@code false} only the
     * well name and failure reason are set, interval lists are empty and the summaries
     * are low-confidence.
     */
    public record PorosityAnalysis(
            String wellName,
            boolean available,
            String failureReason,
            DepthAxis depthAxis,
            DerivedCurve densityPorosity,
            DerivedCurve neutronPorosity,
            DerivedCurve effectivePorosity,
            StatisticsSummary densityStatistics,
            StatisticsSummary neutronStatistics,
            StatisticsSummary effectiveStatistics,
            List<Interval> reservoirIntervals,
            List<Interval> highPorosityZones,
            Interval primaryTarget,
            ReservoirQuality quality,
            DataQuality dataQuality
    ) {
        public static PorosityAnalysis unavailable(String wellName, String reason) {
            return new PorosityAnalysis(wellName, false, reason, null, null, null, null,
                    StatisticsSummary.lowConfidence(PropertyType.DENSITY_POROSITY, 0, 0),
                    StatisticsSummary.lowConfidence(PropertyType.NEUTRON_POROSITY, 0, 0),
                    StatisticsSummary.lowConfidence(PropertyType.EFFECTIVE_POROSITY, 0, 0),
                    List.of(), List.of(), null, ReservoirQuality.UNKNOWN, DataQuality.of(0, 0));
        }
    }

    public record ShaleAnalysis(
            String wellName,
            boolean available,
            String failureReason,
            DepthAxis depthAxis,
            ShaleVolumeMethod method,
            GammaRayBaselines baselines,
            DerivedCurve shaleVolume,
            StatisticsSummary statistics,
            double netToGross,
            List<Interval> cleanSandIntervals,
            Interval primaryTarget,
            ReservoirQuality quality,
            DataQuality dataQuality
    ) {
        public static ShaleAnalysis unavailable(String wellName, String reason) {
            return new ShaleAnalysis(wellName, false, reason, null, null, null, null,
                    StatisticsSummary.lowConfidence(PropertyType.SHALE_VOLUME, 0, 0),
                    0.0, List.of(), null, ReservoirQuality.UNKNOWN, DataQuality.of(0, 0));
        }
    }

    public record SaturationAnalysis(
            String wellName,
            DepthAxis depthAxis,
            DerivedCurve effectivePorosity,
            DerivedCurve waterSaturation,
            StatisticsSummary statistics,
            double hydrocarbonSaturation,
            DataQuality dataQuality
    ) {}
}
