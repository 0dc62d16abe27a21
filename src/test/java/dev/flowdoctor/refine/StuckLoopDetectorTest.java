package dev.flowdoctor.refine;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StuckLoopDetectorTest {

    @Test
    void firstObservationIsNeverStuck() {
        var detector = new StuckLoopDetector(2);

        var observation = detector.observe(Set.of("a"));

        assertThat(observation.stuck()).isFalse();
        assertThat(detector.unfixable()).isEmpty();
    }

    @Test
    void repeatedSignaturesBecomeUnfixableAndStopAtThreshold() {
        var detector = new StuckLoopDetector(2);
        detector.observe(Set.of("a"));

        var second = detector.observe(Set.of("a"));
        var third = detector.observe(Set.of("a"));

        assertThat(second.stuck()).isTrue();
        assertThat(second.shouldStop()).isFalse();
        assertThat(third.consecutiveStuck()).isEqualTo(2);
        assertThat(third.shouldStop()).isTrue();
        assertThat(detector.isUnfixable("a")).isTrue();
    }

    @Test
    void changedSignaturesResetTheCount() {
        var detector = new StuckLoopDetector(2);
        detector.observe(Set.of("a"));
        detector.observe(Set.of("a"));

        var changed = detector.observe(Set.of("a", "b"));

        assertThat(changed.stuck()).isFalse();
        assertThat(changed.consecutiveStuck()).isZero();
        assertThat(detector.isUnfixable("a")).isTrue();
        assertThat(detector.isUnfixable("b")).isFalse();
    }

    @Test
    void emptySignaturesAreNeverStuck() {
        var detector = new StuckLoopDetector(1);
        detector.observe(Set.of());

        assertThat(detector.observe(Set.of()).stuck()).isFalse();
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new StuckLoopDetector(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
