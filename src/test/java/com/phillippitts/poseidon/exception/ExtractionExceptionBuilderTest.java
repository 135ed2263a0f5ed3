package com.phillippitts.poseidon.exception;

import com.phillippitts.poseidon.domain.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionExceptionBuilderTest {

    @Test
    void buildsMessageWithContext() {
        IOException cause = new IOException("reset");

        ExtractionException ex = ExtractionExceptionBuilder.create("Forecast API request failed")
                .backend("direct-api")
                .kind(FailureKind.BACKEND_UNAVAILABLE)
                .httpStatus(503)
                .metadata("path", "/weather/point")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Forecast API request failed (kind=BACKEND_UNAVAILABLE, httpStatus=503, "
                        + "path=/weather/point) (backend: direct-api)");
        assertThat(ex.getBackend()).isEqualTo("direct-api");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void defaultsToUnavailableAndUnknownBackend() {
        ExtractionException ex = ExtractionExceptionBuilder.create("x").kind(null).build();

        assertThat(ex.getKind()).isEqualTo(FailureKind.BACKEND_UNAVAILABLE);
        assertThat(ex.getBackend()).isEqualTo("unknown");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> ExtractionExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hierarchyIsUnchecked() {
        assertThat(new UnknownSpotException("x")).isInstanceOf(PoseidonException.class);
        assertThat(new SessionNotActiveException("c")).isInstanceOf(RuntimeException.class);
        assertThat(new SessionNotActiveException("c").getConversationId()).isEqualTo("c");
    }
}
