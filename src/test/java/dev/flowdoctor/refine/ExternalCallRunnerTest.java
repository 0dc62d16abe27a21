package dev.flowdoctor.refine;

import dev.flowdoctor.backend.ExternalServiceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void returnsTheCallResult() {
        try (var runner = new ExternalCallRunner()) {
            assertThat(runner.call("svc", TIMEOUT, () -> "ok")).isEqualTo("ok");
        }
    }

    @Test
    void rethrowsServiceFailuresUnchanged() {
        var failure = new ExternalServiceException("svc", "down");
        try (var runner = new ExternalCallRunner()) {
            assertThatThrownBy(() -> runner.call("svc", TIMEOUT, () -> {
                throw failure;
            })).isSameAs(failure);
        }
    }

    @Test
    void wrapsOtherFailures() {
        try (var runner = new ExternalCallRunner()) {
            assertThatThrownBy(() -> runner.call("svc", TIMEOUT, () -> {
                throw new IllegalStateException("boom");
            }))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("svc: boom")
                .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void timesOutAndRecoversForTheNextCall() {
        var never = new CountDownLatch(1);
        try (var runner = new ExternalCallRunner()) {
            assertThatThrownBy(() -> runner.call("svc", Duration.ofMillis(50), () -> {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("svc: timed out after 50 ms");

            assertThat(runner.call("svc", TIMEOUT, () -> "next")).isEqualTo("next");
        }
    }
}
