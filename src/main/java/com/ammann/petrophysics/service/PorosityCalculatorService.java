/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.Lithology;
import com.ammann.petrophysics.enumeration.PorosityBlendMethod;
import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.exception.MalformedInputException;
import com.ammann.petrophysics.model.DerivedCurve;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.ParameterSet;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Computes density, neutron and effective porosity from raw log curves.
 *
 * <p>All calculations are pure and sample-by-sample. A missing input sample always
 * produces a missing output sample at the same index, so derived curves stay aligned
 * with the depth axis.
 *
 * <p>Density porosity uses a two-stage policy: an unclamped value outside
 * [-0.15, 0.6] is an implausible reading and becomes missing, anything else is clamped
 * to [0, 0.5]. This keeps "bad measurement" apart from "valid but extreme".
 */
@ApplicationScoped
public class PorosityCalculatorService
{

    private static final Logger LOG = Logger.getLogger(PorosityCalculatorService.class);

    static final double MIN_PLAUSIBLE_DENSITY_POROSITY = -0.15;
    static final double MAX_PLAUSIBLE_DENSITY_POROSITY = 0.6;
    static final double MAX_POROSITY = 0.5;
    static final double SHALE_CORRECTION_FACTOR = 0.5;

    /**
     * Unclamped density porosity φD = (ρma - ρb) / (ρma - ρf).
     *
     * @param rhob   bulk density in g/cc
     * @param params physical constants
     * @return raw porosity, or the sentinel when {@code rhob} is missing
     */
    public double rawDensityPorosity(double rhob, ParameterSet params)
    {
        if (LogCurve.isMissing(rhob)) {
            return LogCurve.NULL_VALUE;
        }
        return (params.matrixDensity() - rhob) / (params.matrixDensity() - params.fluidDensity());
    }

    /**
     * Density porosity of one sample after the plausibility check and clamp.
     */
    public double densityPorosity(double rhob, ParameterSet params)
    {
        double porosity = rawDensityPorosity(rhob, params);
        if (LogCurve.isMissing(porosity)
                || porosity < MIN_PLAUSIBLE_DENSITY_POROSITY
                || porosity > MAX_PLAUSIBLE_DENSITY_POROSITY) {
            return LogCurve.NULL_VALUE;
        }
        return clamp(porosity, 0.0, MAX_POROSITY);
    }

    public double[] densityPorosity(double[] rhob, ParameterSet params)
    {
        double[] result = new double[rhob.length];
        int rejected = 0;
        for (int i = 0; i < rhob.length; i++) {
            result[i] = densityPorosity(rhob[i], params);
            if (result[i] == LogCurve.NULL_VALUE && !LogCurve.isMissing(rhob[i])) {
                rejected++;
            }
        }
        if (rejected > 0) {
            LOG.debugf("Density porosity: %d of %d samples rejected as implausible", rejected, rhob.length);
        }
        return result;
    }

    public DerivedCurve densityPorosity(LogCurve rhob, ParameterSet params)
    {
        String methodology = String.format(
                "Density Porosity: phiD = (%.3f - %s) / (%.3f - %.3f), rejected outside [%.2f, %.2f], clamped to [0, %.2f]",
                params.matrixDensity(), rhob.getName(), params.matrixDensity(), params.fluidDensity(),
                MIN_PLAUSIBLE_DENSITY_POROSITY, MAX_PLAUSIBLE_DENSITY_POROSITY, MAX_POROSITY);
        return new DerivedCurve("PHID", PropertyType.DENSITY_POROSITY, methodology,
                densityPorosity(rhob.samples(), params));
    }

    /**
     * Neutron porosity of one sample.
     *
     * <p>Readings above 1 are taken as percent and divided by 100. The result is
     * scaled by the lithology factor and clamped to [0, 0.5].
     */
    public double neutronPorosity(double nphi, Lithology lithology)
    {
        if (LogCurve.isMissing(nphi)) {
            return LogCurve.NULL_VALUE;
        }
        double fraction = nphi > 1.0 ? nphi / 100.0 : nphi;
        return clamp(fraction * lithology.getNeutronCorrectionFactor(), 0.0, MAX_POROSITY);
    }

    public double[] neutronPorosity(double[] nphi, Lithology lithology)
    {
        double[] result = new double[nphi.length];
        for (int i = 0; i < nphi.length; i++) {
            result[i] = neutronPorosity(nphi[i], lithology);
        }
        return result;
    }

    public DerivedCurve neutronPorosity(LogCurve nphi, Lithology lithology)
    {
        String methodology = String.format(
                "Neutron Porosity: phiN = %s (percent if > 1) x %.2f (%s), clamped to [0, %.2f]",
                nphi.getName(), lithology.getNeutronCorrectionFactor(), lithology, MAX_POROSITY);
        return new DerivedCurve("PHIN", PropertyType.NEUTRON_POROSITY, methodology,
                neutronPorosity(nphi.samples(), lithology));
    }

    /**
     * Effective porosity of one sample.
     *
     * @param densityPorosity density porosity
     * @param neutronPorosity neutron porosity
     * @param shaleVolume     shale volume, or {@code null} for no shale correction
     * @param method          blend method
     */
    public double effectivePorosity(double densityPorosity, double neutronPorosity, Double shaleVolume,
                                    PorosityBlendMethod method)
    {
        if (LogCurve.isMissing(densityPorosity) || LogCurve.isMissing(neutronPorosity)) {
            return LogCurve.NULL_VALUE;
        }
        if (shaleVolume != null && LogCurve.isMissing(shaleVolume)) {
            return LogCurve.NULL_VALUE;
        }

        double effective = method.blend(densityPorosity, neutronPorosity);

        if (shaleVolume != null) {
            double vsh = clamp(shaleVolume, 0.0, 1.0);
            effective = Math.max(0.0, effective - vsh * SHALE_CORRECTION_FACTOR * neutronPorosity);
        }

        return clamp(effective, 0.0, MAX_POROSITY);
    }

    /**
     * @param shaleVolume aligned shale volume, or {@code null} for no shale correction
     * @throws MalformedInputException if the arrays differ in length
     */
    public double[] effectivePorosity(double[] densityPorosity, double[] neutronPorosity, double[] shaleVolume,
                                      PorosityBlendMethod method)
    {
        requireSameLength("neutron porosity", densityPorosity.length, neutronPorosity.length);
        if (shaleVolume != null) {
            requireSameLength("shale volume", densityPorosity.length, shaleVolume.length);
        }

        double[] result = new double[densityPorosity.length];
        for (int i = 0; i < densityPorosity.length; i++) {
            Double vsh = shaleVolume == null ? null : shaleVolume[i];
            result[i] = effectivePorosity(densityPorosity[i], neutronPorosity[i], vsh, method);
        }
        return result;
    }

    public DerivedCurve effectivePorosity(LogCurve densityPorosity, LogCurve neutronPorosity, LogCurve shaleVolume,
                                          PorosityBlendMethod method)
    {
        String methodology = String.format("Effective Porosity: %s blend of %s and %s%s, clamped to [0, %.2f]",
                method, densityPorosity.getName(), neutronPorosity.getName(),
                shaleVolume == null ? "" : ", minus Vsh x 0.5 x phiN",
                MAX_POROSITY);
        double[] values = effectivePorosity(
                densityPorosity.samples(),
                neutronPorosity.samples(),
                shaleVolume == null ? null : shaleVolume.samples(),
                method);
        return new DerivedCurve("PHIE", PropertyType.EFFECTIVE_POROSITY, methodology, values);
    }

    private static void requireSameLength(String name, int expected, int actual)
    {
        if (expected != actual) {
            throw MalformedInputException.lengthMismatch(name, expected, actual);
        }
    }

    private static double clamp(double value, double min, double max)
    {
        return Math.max(min, Math.min(max, value));
    }
}
