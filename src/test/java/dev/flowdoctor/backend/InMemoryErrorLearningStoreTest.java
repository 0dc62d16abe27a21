package dev.flowdoctor.backend;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryErrorLearningStoreTest {

    private final InMemoryErrorLearningStore store = new InMemoryErrorLearningStore();

    @Test
    void sameSignatureSharesOnePattern() {
        String first = store.logPattern(ExternalError.of(12, "Message", "Node 12 is too long"), "csv");
        String second = store.logPattern(ExternalError.of(30, "Message", "Node 30 is too long"), "csv");
        String other = store.logPattern(ExternalError.of(30, "Entity", "Unknown entity"), "csv");

        assertThat(first).isEqualTo(second).isEqualTo("pattern-1");
        assertThat(other).isEqualTo("pattern-2");
        assertThat(store.patternCount()).isEqualTo(2);
        assertThat(store.pattern("message:node x is too long").occurrences()).isEqualTo(2);
    }

    @Test
    void knownFixesAreSuccessfulOnesBestFirst() {
        var error = ExternalError.of(12, "Message", "Node 12 is too long");
        String id = store.logPattern(error, "csv");
        store.logFixAttempt(id, "shortened message", true);
        store.logFixAttempt(id, "shortened message", false);
        store.logFixAttempt(id, "split node", true);
        store.logFixAttempt(id, "removed emoji", false);

        List<FixHint> hints = store.getKnownFixes(List.of(ExternalError.of(99, "Message", "Node 99 is too long")));

        assertThat(hints).extracting(FixHint::fixDescription).containsExactly("split node", "shortened message");
        assertThat(hints).extracting(FixHint::confidence).containsExactly(1.0, 0.5);
        assertThat(hints.get(0).render()).isEqualTo("- [MESSAGE_ERROR] split node (confidence 100%)");
    }

    @Test
    void unknownErrorsHaveNoHints() {
        assertThat(store.getKnownFixes(List.of(ExternalError.of(1, "Message", "new")))).isEmpty();
    }

    @Test
    void rejectsFixAttemptsForUnknownPatterns() {
        assertThatThrownBy(() -> store.logFixAttempt("pattern-42", "anything", true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pattern-42");
    }
}
