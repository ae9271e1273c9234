/* (C)2026 */
package com.ammann.petrophysics.config;

import com.ammann.petrophysics.model.ParameterSet;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds the default {@link ParameterSet} from {@code petrophysics.*} configuration.
 *
 * <p>Values are validated by the record itself, so a bad setting fails startup with an
 * {@link com.ammann.petrophysics.exception.InvalidParameterException}.
 */
@ApplicationScoped
public class ParameterSetProducer
{

    private static final Logger LOG = Logger.getLogger(ParameterSetProducer.class);

    @ConfigProperty(name = "petrophysics.matrix-density", defaultValue = "2.65")
    double matrixDensity = ParameterSet.DEFAULT_MATRIX_DENSITY;

    @ConfigProperty(name = "petrophysics.fluid-density", defaultValue = "1.0")
    double fluidDensity = ParameterSet.DEFAULT_FLUID_DENSITY;

    @ConfigProperty(name = "petrophysics.gr-clean", defaultValue = "25")
    double grClean = ParameterSet.DEFAULT_GR_CLEAN;

    @ConfigProperty(name = "petrophysics.gr-shale", defaultValue = "150")
    double grShale = ParameterSet.DEFAULT_GR_SHALE;

    @ConfigProperty(name = "petrophysics.rw", defaultValue = "0.1")
    double rw = ParameterSet.DEFAULT_RW;

    @ConfigProperty(name = "petrophysics.archie.a", defaultValue = "1.0")
    double archieA = ParameterSet.DEFAULT_ARCHIE_A;

    @ConfigProperty(name = "petrophysics.archie.m", defaultValue = "2.0")
    double archieM = ParameterSet.DEFAULT_ARCHIE_M;

    @ConfigProperty(name = "petrophysics.archie.n", defaultValue = "2.0")
    double archieN = ParameterSet.DEFAULT_ARCHIE_N;

    @Produces
    @Singleton
    public ParameterSet defaultParameterSet()
    {
        ParameterSet params = new ParameterSet(matrixDensity, fluidDensity, grClean, grShale, rw,
                archieA, archieM, archieN);
        LOG.infof("Default petrophysical parameters: %s", params);
        return params;
    }
}
