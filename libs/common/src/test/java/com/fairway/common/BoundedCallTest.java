package com.fairway.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BoundedCall")
class BoundedCallTest {

    @Test
    @DisplayName("returns the collaborator's value")
    void returnsValue() {
        var call = new BoundedCall(Duration.ofSeconds(1));
        assertThat(call.call("encoder", () -> "bytes")).isEqualTo("bytes");
    }

    @Test
    @DisplayName("wraps collaborator failure as UPSTREAM with cause preserved")
    void wrapsFailure() {
        var call = new BoundedCall(Duration.ofSeconds(1));
        var io = new UncheckedIOException(new IOException("connection reset"));

        assertThatThrownBy(() -> call.call("encoder", () -> {
                    throw io;
                }))
                .isInstanceOf(FairwayException.class)
                .satisfies(e -> {
                    var fe = (FairwayException) e;
                    assertThat(fe.kind()).isEqualTo(ErrorKind.UPSTREAM);
                    assertThat(fe.code()).isEqualTo("UPSTREAM_FAILURE");
                    assertThat(fe.getCause()).isSameAs(io);
                });
    }

    @Test
    @DisplayName("reports a timeout as UPSTREAM_TIMEOUT")
    void timesOut() {
        var call = new BoundedCall(Duration.ofMillis(50));

        assertThatThrownBy(() -> call.call("slo-feed", () -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }))
                .isInstanceOf(FairwayException.class)
                .hasMessageContaining("slo-feed")
                .extracting(e -> ((FairwayException) e).code())
                .isEqualTo("UPSTREAM_TIMEOUT");
    }

    @Test
    @DisplayName("rethrows Fairway exceptions from the collaborator unchanged")
    void rethrowsDomainFailure() {
        var call = new BoundedCall(Duration.ofSeconds(1));
        var original = new FairwayException(ErrorKind.VALIDATION, "UNSUPPORTED_FORMAT", "xml");

        assertThatThrownBy(() -> call.call("encoder", () -> {
                    throw original;
                }))
                .isSameAs(original);
    }

    @Test
    @DisplayName("rejects non-positive timeouts")
    void rejectsBadTimeout() {
        assertThatThrownBy(() -> new BoundedCall(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
