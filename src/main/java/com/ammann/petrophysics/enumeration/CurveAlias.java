package com.ammann.petrophysics.enumeration;

import java.util.List;
import java.util.Locale;

/**
 * Logical log curves and the mnemonics they are recorded under.
 *
 * <p>Names are listed in priority order. Resolution first tries an exact,
 * case-insensitive match of each name, then falls back to a substring match
 * against the shorter list of loose names. Short mnemonics such as {@code RHO} or
 * {@code GR}'s neighbours are exact-only, so {@code DRHO} never resolves as density.
 */
public enum CurveAlias
{
    DEPTH(List.of("DEPT", "DEPTH", "MD", "TVDSS"), List.of("DEPT", "DEPTH")),
    DENSITY(List.of("RHOB", "DENSITY", "RHO"), List.of("RHOB", "DENSITY")),
    NEUTRON(List.of("NPHI", "NEUTRON", "NEU"), List.of("NPHI", "NEUTRON")),
    GAMMA_RAY(List.of("GR", "GAMMA_RAY", "GAMMA"), List.of("GR", "GAMMA")),
    RESISTIVITY(List.of("RT", "RESD", "ILD", "LLD", "RES"), List.of("RESD", "ILD", "LLD"));

    private final List<String> names;
    private final List<String> looseNames;

    CurveAlias(List<String> names, List<String> looseNames) {
        this.names = names;
        this.looseNames = looseNames;
    }

    public List<String> getNames() { return names; }

    public List<String> getLooseNames() { return looseNames; }

    /** Returns {@code true} if the mnemonic contains one of the loose names, ignoring case. */
    public boolean matchesLoosely(String mnemonic) {
        String upper = mnemonic.toUpperCase(Locale.ROOT);
        for (String name : looseNames) {
            if (upper.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
