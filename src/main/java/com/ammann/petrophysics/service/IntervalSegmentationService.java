/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.exception.MalformedInputException;
import com.ammann.petrophysics.model.DepthAxis;
import com.ammann.petrophysics.model.Interval;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.SegmentationRule;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds maximal depth runs of samples that satisfy a {@link SegmentationRule}.
 *
 * <p>The scan is a single pass over the samples in depth order with two states,
 * idle and in-run. A qualifying sample opens or extends a run; a non-qualifying or
 * missing sample closes it. A run spans from the depth of its first qualifying sample
 * to the depth of its last qualifying sample. Closed runs that fail the rule's
 * acceptance thresholds are dropped, so the returned intervals never overlap and come
 * back in depth order.
 */
@ApplicationScoped
public class IntervalSegmentationService
{

    private static final Logger LOG = Logger.getLogger(IntervalSegmentationService.class);

    private static final double PERMEABILITY_SCALE_MD = 1000.0;

    private enum ScanState
    {
        IDLE,
        IN_RUN
    }

    /**
     * Segments a curve without shale information.
     */
    public List<Interval> segment(DepthAxis depths, double[] values, SegmentationRule rule)
    {
        return segment(depths, values, rule, null);
    }

    public List<Interval> segment(DepthAxis depths, LogCurve curve, SegmentationRule rule, LogCurve shaleVolume)
    {
        return segment(depths, curve.samples(), rule, shaleVolume == null ? null : shaleVolume.samples());
    }

    /**
     * Segments {@code values} against {@code rule}.
     *
     * @param depths      depth of each sample, non-decreasing
     * @param values      samples aligned with {@code depths}
     * @param rule        cutoff and acceptance thresholds
     * @param shaleVolume optional aligned shale volume used for net pay of porosity runs,
     *                    may be {@code null}
     * @return kept intervals in depth order, unclassified and unranked
     * @throws MalformedInputException if the inputs are not aligned
     */
    public List<Interval> segment(DepthAxis depths, double[] values, SegmentationRule rule, double[] shaleVolume)
    {
        if (values.length != depths.size()) {
            throw MalformedInputException.lengthMismatch("segmented curve", depths.size(), values.length);
        }
        if (shaleVolume != null && shaleVolume.length != depths.size()) {
            throw MalformedInputException.lengthMismatch("shale volume", depths.size(), shaleVolume.length);
        }

        List<Interval> intervals = new ArrayList<>();
        ScanState state = ScanState.IDLE;
        RunAccumulator run = null;
        int rejected = 0;

        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            boolean qualifies = !LogCurve.isMissing(value) && rule.qualifies(value);

            if (qualifies) {
                if (state == ScanState.IDLE) {
                    run = new RunAccumulator(i, depths.depthAt(i));
                    state = ScanState.IN_RUN;
                }
                run.add(i, depths.depthAt(i), value, rule.kind().isPorosityBased());
            } else if (state == ScanState.IN_RUN) {
                if (!close(run, rule, shaleVolume, intervals)) {
                    rejected++;
                }
                run = null;
                state = ScanState.IDLE;
            }
        }

        if (state == ScanState.IN_RUN && !close(run, rule, shaleVolume, intervals)) {
            rejected++;
        }

        LOG.debugf("Segmented %d samples with %s cutoff %.3f: %d intervals kept, %d runs rejected",
                values.length, rule.kind(), rule.cutoff(), intervals.size(), rejected);

        return intervals;
    }

    /**
     * Kozeny-Carman style permeability estimate φ³ / (1 - φ)² x 1000, in mD.
     */
    public static double estimatePermeability(double porosity)
    {
        double solid = 1.0 - porosity;
        if (solid <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.pow(porosity, 3) / (solid * solid) * PERMEABILITY_SCALE_MD;
    }

    /**
     * Net-to-gross ratio from fixed porosity breakpoints.
     */
    public static double netToGross(double meanPorosity)
    {
        if (meanPorosity >= 0.15) return 0.9;
        if (meanPorosity >= 0.10) return 0.75;
        if (meanPorosity >= 0.06) return 0.6;
        return 0.4;
    }

    private boolean close(RunAccumulator run, SegmentationRule rule, double[] shaleVolume, List<Interval> sink)
    {
        double thickness = run.bottomDepth - run.topDepth;
        if (!rule.accepts(run.count, thickness)) {
            LOG.tracef("Rejected %s run %.2f-%.2f (%d points)", rule.kind(), run.topDepth, run.bottomDepth, run.count);
            return false;
        }

        double meanValue = run.sum / run.count;
        double meanShaleVolume;
        Double permeability = null;
        Double netToGross = null;

        if (rule.kind().isPorosityBased()) {
            meanShaleVolume = shaleVolume == null ? 0.0 : meanOfValid(shaleVolume, run.startIndex, run.endIndex);
            permeability = estimatePermeability(meanValue);
            netToGross = netToGross(meanValue);
        } else {
            meanShaleVolume = meanValue;
        }

        double netPay = thickness * (1.0 - meanShaleVolume);

        sink.add(new Interval(rule.kind(), run.topDepth, run.bottomDepth, thickness, meanValue, run.peak,
                run.count, permeability, netToGross, meanShaleVolume, netPay, null, 0));
        return true;
    }

    private static double meanOfValid(double[] values, int from, int to)
    {
        double sum = 0.0;
        int count = 0;
        for (int i = from; i <= to; i++) {
            if (!LogCurve.isMissing(values[i])) {
                sum += values[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static final class RunAccumulator
    {
        final int startIndex;
        final double topDepth;
        int endIndex;
        double bottomDepth;
        double sum;
        int count;
        double peak;

        RunAccumulator(int startIndex, double topDepth)
        {
            this.startIndex = startIndex;
            this.topDepth = topDepth;
        }

        void add(int index, double depth, double value, boolean highIsBetter)
        {
            if (count == 0) {
                peak = value;
            } else {
                peak = highIsBetter ? Math.max(peak, value) : Math.min(peak, value);
            }
            endIndex = index;
            bottomDepth = depth;
            sum += value;
            count++;
        }
    }
}
