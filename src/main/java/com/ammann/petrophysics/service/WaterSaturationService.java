/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.exception.MalformedInputException;
import com.ammann.petrophysics.model.DerivedCurve;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.ParameterSet;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Computes water saturation with the Archie equation
 * Sw = ((a * Rw) / (phi^m * Rt))^(1/n).
 *
 * <p>A sample is missing when either input is missing, porosity is not in (0, 1] or
 * resistivity is not positive. Valid results are clamped to [0, 1].
 */
@ApplicationScoped
public class WaterSaturationService {

    public double archie(double rt, double porosity, ParameterSet params) {
        if (LogCurve.isMissing(rt) || LogCurve.isMissing(porosity)) {
            return LogCurve.NULL_VALUE;
        }
        if (rt <= 0.0 || porosity <= 0.0 || porosity > 1.0) {
            return LogCurve.NULL_VALUE;
        }

        double formationFactor = params.archieA() / Math.pow(porosity, params.archieM());
        double sw = Math.pow(formationFactor * params.rw() / rt, 1.0 / params.archieN());

        return Math.max(0.0, Math.min(1.0, sw));
    }

    /**
     * @throws MalformedInputException if the arrays differ in length
     */
    public double[] archie(double[] rt, double[] porosity, ParameterSet params) {
        if (rt.length != porosity.length) {
            throw MalformedInputException.lengthMismatch("porosity", rt.length, porosity.length);
        }
        double[] result = new double[rt.length];
        for (int i = 0; i < rt.length; i++) {
            result[i] = archie(rt[i], porosity[i], params);
        }
        return result;
    }

    public DerivedCurve archie(LogCurve rt, LogCurve porosity, ParameterSet params) {
        String methodology = String.format(
                "Archie Equation: Sw = ((%.2f * %.3f) / (%s^%.2f * %s))^(1/%.2f)",
                params.archieA(), params.rw(), porosity.getName(), params.archieM(), rt.getName(), params.archieN());
        return new DerivedCurve("SW", PropertyType.WATER_SATURATION, methodology,
                archie(rt.samples(), porosity.samples(), params));
    }
}
