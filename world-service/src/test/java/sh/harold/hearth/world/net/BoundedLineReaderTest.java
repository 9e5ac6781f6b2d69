package sh.harold.hearth.world.net;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class BoundedLineReaderTest {

    @Test
    void acceptsEveryCommonTerminator() throws IOException {
        BoundedLineReader reader = reader("north\nsouth\r\neast\rwest\n", 64);

        assertThat(reader.readLine()).isEqualTo("north");
        assertThat(reader.readLine()).isEqualTo("south");
        assertThat(reader.readLine()).isEqualTo("east");
        assertThat(reader.readLine()).isEqualTo("west");
        assertThat(reader.readLine()).isNull();
    }

    @Test
    void blankLinesAreKept() throws IOException {
        BoundedLineReader reader = reader("\r\n\nlook\n", 64);

        assertThat(reader.readLine()).isEmpty();
        assertThat(reader.readLine()).isEmpty();
        assertThat(reader.readLine()).isEqualTo("look");
    }

    @Test
    void unterminatedLastLineIsReturned() throws IOException {
        BoundedLineReader reader = reader("look\nsay hi", 64);

        assertThat(reader.readLine()).isEqualTo("look");
        assertThat(reader.readLine()).isEqualTo("say hi");
        assertThat(reader.readLine()).isNull();
    }

    @Test
    void lineAtTheLimitIsAccepted() throws IOException {
        assertThat(reader("abcd\n", 4).readLine()).isEqualTo("abcd");
    }

    @Test
    void lineOverTheLimitIsRefused() throws IOException {
        BoundedLineReader reader = reader("ok\nabcde\n", 4);

        assertThat(reader.readLine()).isEqualTo("ok");
        assertThatThrownBy(reader::readLine)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("line longer than 4 characters");
    }

    @Test
    void limitMustBePositive() {
        assertThatThrownBy(() -> reader("", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static BoundedLineReader reader(String text, int maxLineLength) {
        return new BoundedLineReader(new StringReader(text), maxLineLength);
    }
}
