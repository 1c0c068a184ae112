package fr.lapetina.airouter.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @ParameterizedTest
    @CsvSource({
            "401, AUTH",
            "429, RATE_LIMITED",
            "500, UPSTREAM_5XX",
            "503, UPSTREAM_5XX",
            "400, BAD_REQUEST",
            "404, BAD_REQUEST",
            "302, UNKNOWN"
    })
    @DisplayName("should classify HTTP status")
    void shouldClassifyStatus(int status, ErrorKind expected) {
        assertThat(ErrorKind.fromStatus(status)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should stop routing only on request-shape errors")
    void shouldStopRoutingOnlyOnRequestShapeErrors() {
        assertThat(ErrorKind.AUTH.isFailoverEligible()).isFalse();
        assertThat(ErrorKind.BAD_REQUEST.isFailoverEligible()).isFalse();
        assertThat(ErrorKind.RATE_LIMITED.isFailoverEligible()).isTrue();
        assertThat(ErrorKind.UPSTREAM_5XX.isFailoverEligible()).isTrue();
        assertThat(ErrorKind.TIMEOUT.isFailoverEligible()).isTrue();
        assertThat(ErrorKind.UNKNOWN.isFailoverEligible()).isTrue();
    }
}
