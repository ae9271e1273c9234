/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.CurveAlias;
import com.ammann.petrophysics.exception.MalformedInputException;
import com.ammann.petrophysics.model.DepthAxis;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.WellLogDataset;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses LAS 2.0 text into a {@link WellLogDataset}.
 *
 * <p>Supported layout: sections introduced by {@code ~V}, {@code ~W}, {@code ~C},
 * {@code ~P}, {@code ~O} and {@code ~A}; header lines of the form
 * {@code MNEM.UNIT  VALUE : DESCRIPTION}; whitespace-delimited ASCII data in curve
 * declaration order. Lines starting with {@code #} are comments.
 *
 * <p>Data rows whose column count differs from the declared curve count, or whose
 * index value cannot be read, are skipped and counted. Other unparsable values become
 * missing samples. Values equal to the {@code NULL} declared in the well section are
 * normalised to {@link LogCurve#NULL_VALUE}. Files recorded bottom-up are reversed so
 * the depth axis is non-decreasing.
 */
@ApplicationScoped
public class LasParsingService
{

    private static final Logger LOG = Logger.getLogger(LasParsingService.class);

    static final String WELL_NAME_HEADER = "WELL";
    static final String NULL_HEADER = "NULL";

    /**
     * Parses LAS content, taking the well name from the {@code WELL} header.
     */
    public WellLogDataset parse(String content)
    {
        return parse(content, null);
    }

    /**
     * Parses LAS content.
     *
     * @param content          LAS text
     * @param wellNameOverride well name to use instead of the {@code WELL} header,
     *                         ignored when blank
     * @return dataset with one curve per declared non-index curve
     * @throws MalformedInputException if no curves are declared, no data rows remain or
     *                                 the index is not monotonic
     */
    public WellLogDataset parse(String content, String wellNameOverride)
    {
        if (content == null || content.isBlank()) {
            throw new MalformedInputException("LAS content is empty");
        }

        Map<String, String> wellInfo = new LinkedHashMap<>();
        List<CurveDefinition> curves = new ArrayList<>();
        List<String> dataLines = new ArrayList<>();
        char section = 0;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("~")) {
                section = line.length() > 1 ? Character.toUpperCase(line.charAt(1)) : 0;
                continue;
            }
            switch (section) {
                case 'W' -> {
                    HeaderLine header = parseHeaderLine(line);
                    if (header != null) {
                        wellInfo.put(header.mnemonic(), header.value());
                    }
                }
                case 'C' -> {
                    HeaderLine header = parseHeaderLine(line);
                    if (header != null) {
                        curves.add(new CurveDefinition(header.mnemonic(), header.unit(), header.description()));
                    }
                }
                case 'A' -> dataLines.add(line);
                default -> {
                    // version, parameter and other sections carry nothing the dataset keeps
                }
            }
        }

        if (curves.isEmpty()) {
            throw new MalformedInputException("LAS content declares no curves in a ~C section");
        }
        if (dataLines.isEmpty()) {
            throw new MalformedInputException("LAS content has no ~A data");
        }

        String wellName = wellNameOverride != null && !wellNameOverride.isBlank()
                ? wellNameOverride.strip()
                : wellInfo.getOrDefault(WELL_NAME_HEADER, "");
        Double nullValue = parseNullValue(wellInfo.get(NULL_HEADER));
        int indexColumn = indexColumn(curves);

        List<double[]> rows = new ArrayList<>(dataLines.size());
        int skipped = 0;
        for (String line : dataLines) {
            String[] tokens = line.split("\\s+");
            if (tokens.length != curves.size()) {
                skipped++;
                continue;
            }
            double[] row = new double[tokens.length];
            for (int c = 0; c < tokens.length; c++) {
                row[c] = parseValue(tokens[c], nullValue);
            }
            if (LogCurve.isMissing(row[indexColumn])) {
                skipped++;
                continue;
            }
            rows.add(row);
        }

        if (skipped > 0) {
            LOG.warnf("Skipped %d malformed data lines while parsing well '%s'", skipped, wellName);
        }
        if (rows.isEmpty()) {
            throw new MalformedInputException(
                    String.format("LAS content for well '%s' has no usable data rows", wellName));
        }
        if (rows.size() > 1 && rows.get(0)[indexColumn] > rows.get(rows.size() - 1)[indexColumn]) {
            Collections.reverse(rows);
        }

        double[] depths = column(rows, indexColumn);
        List<LogCurve> logCurves = new ArrayList<>(curves.size() - 1);
        for (int c = 0; c < curves.size(); c++) {
            if (c == indexColumn) {
                continue;
            }
            CurveDefinition def = curves.get(c);
            logCurves.add(new LogCurve(def.mnemonic(), def.unit(), def.description(), column(rows, c)));
        }

        WellLogDataset dataset = new WellLogDataset(wellName, DepthAxis.of(depths), logCurves, wellInfo);
        LOG.infof("Parsed LAS well '%s': %d samples, curves %s, index '%s'",
                dataset.getWellName(), dataset.size(), dataset.getCurveNames(), curves.get(indexColumn).mnemonic());
        return dataset;
    }

    /**
     * Splits {@code MNEM.UNIT VALUE : DESCRIPTION}. The unit runs from the first dot
     * to the first whitespace; the description follows the last colon.
     *
     * @return the parsed line, or {@code null} when the line has no mnemonic dot
     */
    static HeaderLine parseHeaderLine(String line)
    {
        int dot = line.indexOf('.');
        if (dot <= 0) {
            return null;
        }
        String mnemonic = line.substring(0, dot).strip().toUpperCase(Locale.ROOT);
        if (mnemonic.isEmpty()) {
            return null;
        }

        String rest = line.substring(dot + 1);
        int colon = rest.lastIndexOf(':');
        String beforeColon = colon >= 0 ? rest.substring(0, colon) : rest;
        String description = colon >= 0 ? rest.substring(colon + 1).strip() : "";

        String unit = "";
        String value = beforeColon.strip();
        if (!beforeColon.isEmpty() && !Character.isWhitespace(beforeColon.charAt(0))) {
            String[] unitAndValue = beforeColon.split("\\s+", 2);
            unit = unitAndValue[0];
            value = unitAndValue.length > 1 ? unitAndValue[1].strip() : "";
        }
        return new HeaderLine(mnemonic, unit, value, description);
    }

    static int indexColumn(List<CurveDefinition> curves)
    {
        for (String name : CurveAlias.DEPTH.getNames()) {
            for (int c = 0; c < curves.size(); c++) {
                if (curves.get(c).mnemonic().equals(name)) {
                    return c;
                }
            }
        }
        for (int c = 0; c < curves.size(); c++) {
            if (CurveAlias.DEPTH.matchesLoosely(curves.get(c).mnemonic())) {
                return c;
            }
        }
        return 0;
    }

    private static Double parseNullValue(String declared)
    {
        if (declared == null || declared.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(declared.strip());
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring unreadable NULL declaration '%s'", declared);
            return null;
        }
    }

    private static double parseValue(String token, Double nullValue)
    {
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return LogCurve.NULL_VALUE;
        }
        if (nullValue != null && value == nullValue) {
            return LogCurve.NULL_VALUE;
        }
        return Double.isFinite(value) ? value : LogCurve.NULL_VALUE;
    }

    private static double[] column(List<double[]> rows, int index)
    {
        double[] values = new double[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            values[r] = rows.get(r)[index];
        }
        return values;
    }

    record HeaderLine(String mnemonic, String unit, String value, String description) {}

    record CurveDefinition(String mnemonic, String unit, String description) {}
}
