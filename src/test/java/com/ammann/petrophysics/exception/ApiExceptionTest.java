package com.ammann.petrophysics.exception;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionTest
{

    @ParameterizedTest
    @MethodSource("insufficientDataSamples")
    void buildsInsufficientDataMessages(String resource, int required, int actual, String expected)
    {
        InsufficientDataException ex = InsufficientDataException.insufficientData(resource, required, actual);
        assertThat(ex.getMessage()).isEqualTo(expected);
        assertThat(ex.getRequired()).isEqualTo(required);
        assertThat(ex.getActual()).isEqualTo(actual);
    }

    @ParameterizedTest
    @CsvSource({
            "porosityCutoff,-1,a value in",
            "wellNames,null,at least one well name"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        InvalidParameterException ex = InvalidParameterException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
        assertThat(ex).isInstanceOf(ValidationException.class);
    }

    @Test
    void describesLengthMismatch()
    {
        assertThat(MalformedInputException.lengthMismatch("GR", 100, 99).getMessage())
                .isEqualTo("Curve 'GR' has 99 samples but the depth axis has 100");
    }

    @Test
    void listsTriedMnemonicsForMissingCurve()
    {
        assertThat(CurveNotFoundException.forAlias("GAMMA_RAY", List.of("GR", "GAMMA_RAY"), "W-9").getMessage())
                .isEqualTo("No GAMMA_RAY curve in well 'W-9' (tried [GR, GAMMA_RAY])");
    }

    private static Stream<Arguments> insufficientDataSamples()
    {
        return Stream.of(
                Arguments.of("valid density porosity samples", 10, 4,
                        "Insufficient valid density porosity samples: need at least 10, but got 4"),
                Arguments.of("gamma-ray samples for baseline estimation", 2, 0,
                        "Insufficient gamma-ray samples for baseline estimation: need at least 2, but got 0")
        );
    }
}
