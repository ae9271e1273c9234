package com.ammann.petrophysics.enumeration;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ShaleQualityTest
{

    @ParameterizedTest
    @CsvSource({
            "0.0,EXCELLENT",
            "0.15,EXCELLENT",
            "0.1501,GOOD",
            "0.30,GOOD",
            "0.50,FAIR",
            "0.51,POOR"
    })
    void mapsShaleVolumeToQuality(double shaleVolume, ShaleQuality expected)
    {
        assertThat(ShaleQuality.fromShaleVolume(shaleVolume)).isEqualTo(expected);
    }
}
