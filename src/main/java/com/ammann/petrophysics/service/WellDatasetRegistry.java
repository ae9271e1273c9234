/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.cache.WellAvailabilityCache;
import com.ammann.petrophysics.cache.WellAvailabilityCache.WellAvailability;
import com.ammann.petrophysics.model.WellLogDataset;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory store of parsed wells for the REST tool surface.
 *
 * <p>Registering or removing a well invalidates the availability snapshot.
 */
@ApplicationScoped
public class WellDatasetRegistry
{

    private static final Logger LOG = Logger.getLogger(WellDatasetRegistry.class);

    private final ConcurrentMap<String, WellLogDataset> wells = new ConcurrentHashMap<>();
    private final WellAvailabilityCache availabilityCache;
    private final Clock clock;

    @Inject
    public WellDatasetRegistry(@ConfigProperty(name = "petrophysics.wells.cache-ttl", defaultValue = "5M")
                               Duration cacheTtl)
    {
        this(Clock.systemUTC(), cacheTtl);
    }

    WellDatasetRegistry(Clock clock, Duration cacheTtl)
    {
        this.clock = clock;
        this.availabilityCache = new WellAvailabilityCache(clock, cacheTtl);
    }

    /**
     * Stores a dataset under its well name, replacing any earlier one.
     *
     * @return {@code true} if an earlier dataset was replaced
     */
    public boolean register(WellLogDataset dataset)
    {
        WellLogDataset previous = wells.put(dataset.getWellName(), dataset);
        availabilityCache.invalidate();
        LOG.infof("%s well %s (%d samples, curves %s)", previous == null ? "Registered" : "Replaced",
                dataset.getWellName(), dataset.size(), dataset.getCurveNames());
        return previous != null;
    }

    public Optional<WellLogDataset> find(String wellName)
    {
        return Optional.ofNullable(wells.get(wellName));
    }

    /**
     * @throws NotFoundException if no well is registered under {@code wellName}
     */
    public WellLogDataset require(String wellName)
    {
        return find(wellName).orElseThrow(
                () -> new NotFoundException("Well '" + wellName + "' is not registered"));
    }

    /** Resolves several wells in the given order. */
    public List<WellLogDataset> requireAll(List<String> wellNames)
    {
        List<WellLogDataset> datasets = new ArrayList<>(wellNames.size());
        for (String name : wellNames) {
            datasets.add(require(name));
        }
        return datasets;
    }

    public boolean remove(String wellName)
    {
        boolean removed = wells.remove(wellName) != null;
        if (removed) {
            availabilityCache.invalidate();
            LOG.infof("Removed well %s", wellName);
        }
        return removed;
    }

    /** Cached snapshot of the registered well names. */
    public WellAvailability availability()
    {
        return availabilityCache.get(() -> {
            List<String> names = new ArrayList<>(wells.keySet());
            names.sort(String::compareTo);
            return new WellAvailability(names, clock.instant());
        });
    }
}
