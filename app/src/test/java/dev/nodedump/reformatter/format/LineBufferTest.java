package dev.nodedump.reformatter.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.nodedump.reformatter.diagnostic.InvariantViolation;
import org.junit.jupiter.api.Test;

class LineBufferTest {

    @Test
    void refusesToGrowPastCapacity() {
        LineBuffer buffer = new LineBuffer(3);
        buffer.append('a').append('b').append('c');

        assertThat(buffer.isFull()).isTrue();
        assertThatThrownBy(() -> buffer.append('d'))
                .isInstanceOf(InvariantViolation.class)
                .hasMessageContaining("line length < capacity");
        assertThat(buffer.contents()).isEqualTo("abc");
    }

    @Test
    void resetFillsIndentWithSpaces() {
        LineBuffer buffer = new LineBuffer(10);
        buffer.append('x');

        buffer.reset(4);

        assertThat(buffer.contents()).isEqualTo("    ");
        assertThat(buffer.length()).isEqualTo(4);
        assertThatThrownBy(() -> buffer.reset(11)).isInstanceOf(InvariantViolation.class);
    }

    @Test
    void findsLastCharacterAfterLowerBound() {
        LineBuffer buffer = new LineBuffer(10);
        " ab cd".chars().forEach(ch -> buffer.append((char) ch));

        assertThat(buffer.lastIndexOf(' ', 0)).isEqualTo(3);
        assertThat(buffer.lastIndexOf(' ', 3)).isEqualTo(-1);

        buffer.truncate(3);
        assertThat(buffer.lastIndexOf(' ', 0)).isEqualTo(-1);
        assertThat(buffer.contents()).isEqualTo(" ab");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new LineBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
