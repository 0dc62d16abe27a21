package dev.flowdoctor.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ButtonTextTest {

    @Test
    void rejoinsLabelsSplitByStrayPipe() {
        assertThat(ButtonText.normalize("$25|k~10|$50k~20")).isEqualTo("$25k~10|$50k~20");
    }

    @Test
    void insertsMissingSeparators() {
        assertThat(ButtonText.normalize("Yes~10No~20")).isEqualTo("Yes~10|No~20");
    }

    @Test
    void collapsesEmptySegments() {
        assertThat(ButtonText.normalize("|A~1||B~2|")).isEqualTo("A~1|B~2");
    }

    @Test
    void leavesJsonAndPlainTextAlone() {
        assertThat(ButtonText.normalize("{\"a\":1}")).isEqualTo("{\"a\":1}");
        assertThat(ButtonText.normalize("just text")).isEqualTo("just text");
    }

    @Test
    void normalizeIsIdempotent() {
        String once = ButtonText.normalize("$25|k~10Other~20||");

        assertThat(ButtonText.normalize(once)).isEqualTo(once);
    }

    @Test
    void describesDefects() {
        assertThat(ButtonText.defects("Yes~10No~20")).containsExactly("missing | between buttons");
        assertThat(ButtonText.defects("A~1|B~2")).isEmpty();
    }
}
