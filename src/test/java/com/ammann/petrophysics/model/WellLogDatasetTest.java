/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.CurveAlias;
import com.ammann.petrophysics.exception.CurveNotFoundException;
import com.ammann.petrophysics.exception.InvalidParameterException;
import com.ammann.petrophysics.exception.MalformedInputException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WellLogDatasetTest {

    private static WellLogDataset dataset(LogCurve... curves) {
        return new WellLogDataset("W-1", DepthAxis.of(100.0, 101.0, 102.0), List.of(curves));
    }

    private static LogCurve curve(String name) {
        return new LogCurve(name, "", new double[] {1.0, 2.0, 3.0});
    }

    @Test
    void rejectsMisalignedCurve() {
        assertThatThrownBy(() -> dataset(new LogCurve("GR", "GAPI", new double[] {1.0})))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("GR");
    }

    @Test
    void rejectsDuplicateMnemonic() {
        assertThatThrownBy(() -> dataset(curve("GR"), curve("gr")))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void blankNameBecomesUnknown() {
        assertThat(new WellLogDataset(" ", DepthAxis.of(), List.of()).getWellName()).isEqualTo("UNKNOWN");
    }

    @Nested
    class CurveResolution {

        @Test
        void exactMatchWinsOverSubstring() {
            WellLogDataset well = dataset(curve("RHOB_CORR"), curve("RHOB"));

            assertThat(well.resolve(CurveAlias.DENSITY).getName()).isEqualTo("RHOB");
        }

        @Test
        void earlierAliasNameWins() {
            WellLogDataset well = dataset(curve("RES"), curve("ILD"), curve("RT"));

            assertThat(well.resolve(CurveAlias.RESISTIVITY).getName()).isEqualTo("RT");
        }

        @Test
        void fallsBackToSubstringMatch() {
            WellLogDataset well = dataset(curve("SGR_EDTC"));

            assertThat(well.find(CurveAlias.GAMMA_RAY)).hasValueSatisfying(
                    c -> assertThat(c.getName()).isEqualTo("SGR_EDTC"));
        }

        @Test
        void densityCorrectionIsNotTakenForDensity() {
            WellLogDataset well = dataset(curve("DRHO"), curve("RHOZ"), curve("NEUT"));

            assertThat(well.find(CurveAlias.DENSITY)).isEmpty();
            assertThat(well.find(CurveAlias.NEUTRON)).isEmpty();
        }

        @Test
        void fullMnemonicStillMatchesBySubstring() {
            WellLogDataset well = dataset(curve("DRHO"), curve("RHOB_EDTC"));

            assertThat(well.resolve(CurveAlias.DENSITY).getName()).isEqualTo("RHOB_EDTC");
        }

        @Test
        void mnemonicLookupIgnoresCase() {
            assertThat(dataset(curve("NPHI")).curve("nphi")).isPresent();
        }

        @Test
        void missingAliasNamesTriedMnemonics() {
            WellLogDataset well = dataset(curve("CALI"));

            assertThat(well.has(CurveAlias.NEUTRON)).isFalse();
            assertThatThrownBy(() -> well.resolve(CurveAlias.NEUTRON))
                    .isInstanceOf(CurveNotFoundException.class)
                    .hasMessageContaining("NPHI")
                    .hasMessageContaining("W-1");
        }
    }

    @Nested
    class DepthFiltering {

        @Test
        void keepsAlignmentInsideInclusiveRange() {
            WellLogDataset well = dataset(curve("GR"), curve("RHOB"));

            WellLogDataset filtered = well.filterByDepthRange(101.0, 102.0);

            assertThat(filtered.getDepthAxis().values()).containsExactly(101.0, 102.0);
            assertThat(filtered.curve("GR").orElseThrow().samples()).containsExactly(2.0, 3.0);
            assertThat(filtered.curve("RHOB").orElseThrow().samples()).containsExactly(2.0, 3.0);
            assertThat(filtered.getCurveNames()).containsExactly("GR", "RHOB");
            assertThat(well.size()).isEqualTo(3);
        }

        @Test
        void rangeOutsideDataGivesEmptyDataset() {
            assertThat(dataset(curve("GR")).filterByDepthRange(500.0, 600.0).size()).isZero();
        }

        @Test
        void rejectsInvertedRange() {
            assertThatThrownBy(() -> dataset(curve("GR")).filterByDepthRange(102.0, 100.0))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }
}
