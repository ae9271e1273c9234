/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.CurveAlias;
import com.ammann.petrophysics.exception.CurveNotFoundException;
import com.ammann.petrophysics.exception.InvalidParameterException;
import com.ammann.petrophysics.exception.MalformedInputException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Depth-aligned set of log curves for one well.
 *
 * <p>Every curve has exactly one sample per depth of the {@link DepthAxis}; this is
 * checked on construction. Curves are looked up by mnemonic (case-insensitive) or by
 * {@link CurveAlias}, and the whole dataset can be narrowed to a depth window. The
 * dataset is immutable once built.
 */
public final class WellLogDataset {

    private static final Logger LOG = Logger.getLogger(WellLogDataset.class);

    private final String wellName;
    private final DepthAxis depthAxis;
    private final Map<String, LogCurve> curves;
    private final Map<String, String> wellInfo;

    /**
     * @param wellName  well identifier
     * @param depthAxis shared sample positions
     * @param curves    curves in declaration order; each must match the axis length
     * @param wellInfo  header values from the well section, may be empty
     * @throws MalformedInputException if a curve length differs from the axis length
     *                                 or two curves share a mnemonic
     */
    public WellLogDataset(String wellName, DepthAxis depthAxis, List<? extends LogCurve> curves,
                          Map<String, String> wellInfo) {
        if (depthAxis == null) {
            throw new MalformedInputException("Dataset requires a depth axis");
        }
        this.wellName = wellName == null || wellName.isBlank() ? "UNKNOWN" : wellName;
        this.depthAxis = depthAxis;

        Map<String, LogCurve> byName = new LinkedHashMap<>();
        for (LogCurve curve : curves) {
            if (curve.size() != depthAxis.size()) {
                throw MalformedInputException.lengthMismatch(curve.getName(), depthAxis.size(), curve.size());
            }
            String key = curve.getName().toUpperCase(Locale.ROOT);
            if (byName.putIfAbsent(key, curve) != null) {
                throw new MalformedInputException(
                        String.format("Duplicate curve mnemonic '%s' in well '%s'", curve.getName(), this.wellName));
            }
        }
        this.curves = Collections.unmodifiableMap(byName);
        this.wellInfo = wellInfo == null ? Map.of() : Map.copyOf(wellInfo);
    }

    public WellLogDataset(String wellName, DepthAxis depthAxis, List<? extends LogCurve> curves) {
        this(wellName, depthAxis, curves, Map.of());
    }

    public String getWellName() { return wellName; }

    public DepthAxis getDepthAxis() { return depthAxis; }

    public Map<String, String> getWellInfo() { return wellInfo; }

    /** Number of depth samples. */
    public int size() {
        return depthAxis.size();
    }

    /** Curve mnemonics in declaration order. */
    public List<String> getCurveNames() {
        List<String> names = new ArrayList<>(curves.size());
        curves.values().forEach(c -> names.add(c.getName()));
        return names;
    }

    public List<LogCurve> getCurves() {
        return List.copyOf(curves.values());
    }

    /** Looks up a curve by its exact mnemonic, ignoring case. */
    public Optional<LogCurve> curve(String mnemonic) {
        return Optional.ofNullable(curves.get(mnemonic.toUpperCase(Locale.ROOT)));
    }

    /**
     * Finds the curve recorded under one of the alias names. Exact matches win over
     * substring matches; within each pass the alias priority order is kept.
     */
    public Optional<LogCurve> find(CurveAlias alias) {
        for (String name : alias.getNames()) {
            LogCurve exact = curves.get(name);
            if (exact != null) {
                return Optional.of(exact);
            }
        }
        for (LogCurve curve : curves.values()) {
            if (alias.matchesLoosely(curve.getName())) {
                LOG.debugf("Resolved %s to curve '%s' by substring match in well %s",
                        alias, curve.getName(), wellName);
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a logical curve.
     *
     * @throws CurveNotFoundException if no alias name matches
     */
    public LogCurve resolve(CurveAlias alias) {
        return find(alias).orElseThrow(
                () -> CurveNotFoundException.forAlias(alias.name(), alias.getNames(), wellName));
    }

    public boolean has(CurveAlias alias) {
        return find(alias).isPresent();
    }

    /**
     * Returns a new dataset restricted to samples whose depth lies in {@code [start, end]},
     * keeping order and alignment.
     *
     * @throws InvalidParameterException if a bound is not finite or {@code start > end}
     */
    public WellLogDataset filterByDepthRange(double start, double end) {
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw InvalidParameterException.invalidParameter("depthRange", start + ".." + end, "finite bounds");
        }
        if (start > end) {
            throw InvalidParameterException.invalidParameter("depthRange", start + ".." + end, "start <= end");
        }
        int[] indices = depthAxis.indicesWithin(start, end);
        List<LogCurve> selected = new ArrayList<>(curves.size());
        for (LogCurve curve : curves.values()) {
            selected.add(curve.select(indices));
        }
        LOG.debugf("Depth filter %.2f-%.2f kept %d of %d samples in well %s",
                start, end, indices.length, depthAxis.size(), wellName);
        return new WellLogDataset(wellName, depthAxis.select(indices), selected, wellInfo);
    }

    @Override
    public String toString() {
        return String.format("WellLogDataset[%s, %s, curves=%s]", wellName, depthAxis, getCurveNames());
    }
}
