package com.phillippitts.simrecon.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineInvocationExceptionBuilderTest {

    @Test
    void buildsMessageWithAllDetails() {
        EngineInvocationException ex = EngineInvocationExceptionBuilder.create("Non-zero exit: 3")
                .engine("makeotf")
                .exitCode(3)
                .durationMs(1500)
                .metadata("input", "/data/psf.dv")
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Non-zero exit: 3 (exitCode=3, durationMs=1500, input=/data/psf.dv) (engine: makeotf)");
        assertThat(ex.getEngineName()).isEqualTo("makeotf");
    }

    @Test
    void plainMessageWhenNoDetails() {
        EngineInvocationException ex = EngineInvocationExceptionBuilder.create("failed").build();

        assertThat(ex.getMessage()).isEqualTo("failed (engine: unknown)");
        assertThat(ex.getEngineName()).isEqualTo("unknown");
    }

    @Test
    void ignoresNullMetadata() {
        EngineInvocationException ex = EngineInvocationExceptionBuilder.create("failed")
                .metadata("input", null)
                .metadata(null, "x")
                .exitCode(1)
                .build();

        assertThat(ex.getMessage()).isEqualTo("failed (exitCode=1) (engine: unknown)");
    }

    @Test
    void keepsCause() {
        IOException cause = new IOException("no such binary");
        EngineInvocationException ex = EngineInvocationExceptionBuilder.create("Failed to start")
                .engine("cudasirecon")
                .cause(cause)
                .build();

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> EngineInvocationExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
