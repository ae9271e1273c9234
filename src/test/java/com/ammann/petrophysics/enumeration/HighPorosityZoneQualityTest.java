package com.ammann.petrophysics.enumeration;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class HighPorosityZoneQualityTest
{

    @ParameterizedTest
    @CsvSource({
            "0.20,EXCEPTIONAL",
            "0.1999,EXCELLENT",
            "0.15,EXCELLENT",
            "0.12,VERY_GOOD",
            "0.1199,GOOD"
    })
    void mapsPorosityToQuality(double porosity, HighPorosityZoneQuality expected)
    {
        assertThat(HighPorosityZoneQuality.fromPorosity(porosity)).isEqualTo(expected);
    }
}
