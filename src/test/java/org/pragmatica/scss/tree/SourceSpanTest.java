package org.pragmatica.scss.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceSpanTest {

    @Test
    void negativeValues_areRejected() {
        assertThatThrownBy(() -> new SourceSpan(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SourceSpan.of(5, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contains_isHalfOpen() {
        var span = SourceSpan.of(2, 5);

        assertThat(span.contains(2)).isTrue();
        assertThat(span.contains(4)).isTrue();
        assertThat(span.contains(5)).isFalse();
        assertThat(span.contains(SourceSpan.of(3, 5))).isTrue();
        assertThat(span.contains(SourceSpan.of(3, 6))).isFalse();
    }

    @Test
    void merge_coversBothSpans() {
        assertThat(SourceSpan.of(2, 4)
                             .merge(SourceSpan.of(7, 9))).isEqualTo(SourceSpan.of(2, 9));
    }

    @Test
    void extract_andToString() {
        var span = SourceSpan.of(4, 9);

        assertThat(span.extract("a { color: red; }")).isEqualTo("color");
        assertThat(span).hasToString("4-9");
    }
}
