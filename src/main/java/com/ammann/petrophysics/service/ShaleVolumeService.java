/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.enumeration.ShaleVolumeMethod;
import com.ammann.petrophysics.exception.InsufficientDataException;
import com.ammann.petrophysics.model.DerivedCurve;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.ParameterSet;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;
import org.jboss.logging.Logger;

/**
 * Computes shale volume from a gamma-ray log.
 *
 * <p>The gamma-ray index IGR = (GR - GRclean) / (GRshale - GRclean) is clamped to
 * [0, 1] before the method transform; the transformed volume is clamped to [0, 1].
 */
@ApplicationScoped
public class ShaleVolumeService {

    private static final Logger LOG = Logger.getLogger(ShaleVolumeService.class);

    static final double SHALE_BASELINE_PERCENTILE = 0.95;
    static final int MIN_SAMPLES_FOR_BASELINES = 2;
    static final int MIN_DISTINCT_BASELINE_LEVELS = 2;

    /**
     * Gamma-ray index of one sample, clamped to [0, 1].
     */
    public double gammaRayIndex(double gr, ParameterSet params) {
        return gammaRayIndex(gr, GammaRayBaselines.of(params));
    }

    public double gammaRayIndex(double gr, GammaRayBaselines baselines) {
        if (LogCurve.isMissing(gr)) {
            return LogCurve.NULL_VALUE;
        }
        double igr = (gr - baselines.clean()) / (baselines.shale() - baselines.clean());
        return clamp(igr);
    }

    public double shaleVolume(double gr, ParameterSet params, ShaleVolumeMethod method) {
        return shaleVolume(gr, GammaRayBaselines.of(params), method);
    }

    public double shaleVolume(double gr, GammaRayBaselines baselines, ShaleVolumeMethod method) {
        double igr = gammaRayIndex(gr, baselines);
        if (igr == LogCurve.NULL_VALUE) {
            return LogCurve.NULL_VALUE;
        }
        return clamp(method.transform(igr));
    }

    public double[] shaleVolume(double[] gr, ParameterSet params, ShaleVolumeMethod method) {
        return shaleVolume(gr, GammaRayBaselines.of(params), method);
    }

    public double[] shaleVolume(double[] gr, GammaRayBaselines baselines, ShaleVolumeMethod method) {
        double[] result = new double[gr.length];
        for (int i = 0; i < gr.length; i++) {
            result[i] = shaleVolume(gr[i], baselines, method);
        }
        return result;
    }

    public DerivedCurve shaleVolume(LogCurve gr, ParameterSet params, ShaleVolumeMethod method) {
        return shaleVolume(gr, GammaRayBaselines.of(params), method);
    }

    /**
     * Shale-volume curve for baselines that did not come from configuration, such as
     * those picked by {@link #estimateBaselines(LogCurve)}. They skip the configured
     * API range but must still satisfy shale above clean.
     */
    public DerivedCurve shaleVolume(LogCurve gr, GammaRayBaselines baselines, ShaleVolumeMethod method) {
        String methodology = String.format("%s, where IGR = (%s - %.1f) / (%.1f - %.1f)",
                method.getFormula(), gr.getName(), baselines.clean(), baselines.shale(), baselines.clean());
        return new DerivedCurve("VSH", PropertyType.SHALE_VOLUME, methodology,
                shaleVolume(gr.samples(), baselines, method));
    }

    /**
     * Picks gamma-ray baselines from the log itself: the clean baseline is the minimum
     * valid reading and the shale baseline the reading at the 95th percentile
     * ({@code sorted[floor(0.95 * n)]}).
     *
     * @throws InsufficientDataException if fewer than two valid readings exist, or the
     *                                   95th-percentile reading does not exceed the minimum
     */
    public GammaRayBaselines estimateBaselines(LogCurve gr) {
        double[] valid = Arrays.stream(gr.samples())
                .filter(v -> !LogCurve.isMissing(v))
                .sorted()
                .toArray();

        if (valid.length < MIN_SAMPLES_FOR_BASELINES) {
            throw InsufficientDataException.insufficientData(
                    "gamma-ray samples for baseline estimation", MIN_SAMPLES_FOR_BASELINES, valid.length);
        }

        double clean = valid[0];
        double shale = valid[(int) Math.floor(valid.length * SHALE_BASELINE_PERCENTILE)];

        if (shale <= clean) {
            throw new InsufficientDataException(String.format(
                    "Gamma-ray log has no usable range for baseline estimation: clean %.2f, shale %.2f",
                    clean, shale), MIN_DISTINCT_BASELINE_LEVELS, 1);
        }

        LOG.debugf("Estimated GR baselines from %d samples: clean=%.2f, shale=%.2f", (Object) Integer.valueOf(valid.length), clean, shale);
        return new GammaRayBaselines(clean, shale);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Clean-sand and shale gamma-ray readings in API units.
     */
    public record GammaRayBaselines(double clean, double shale) {

        public static GammaRayBaselines of(ParameterSet params) {
            return new GammaRayBaselines(params.grClean(), params.grShale());
        }
    }
}
