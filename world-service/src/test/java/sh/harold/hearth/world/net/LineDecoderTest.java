package sh.harold.hearth.world.net;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

final class LineDecoderTest {

    @Test
    void plainTextPassesThrough() {
        assertThat(LineDecoder.decode("look")).isEqualTo("look");
        assertThat(LineDecoder.decode(null)).isNull();
    }

    @Test
    void carriageReturnsAndNulsAreDropped() {
        assertThat(LineDecoder.decode("look\r")).isEqualTo("look");
        assertThat(LineDecoder.decode("lo\0ok")).isEqualTo("look");
    }

    @Test
    void negotiationSequencesAreStripped() {
        String will = "\u00FF\u00FB\u0018";
        String doEcho = "\u00FF\u00FD\u0001";
        assertThat(LineDecoder.decode(will + "north" + doEcho)).isEqualTo("north");
    }

    @Test
    void subnegotiationIsStrippedUpToItsEnd() {
        String terminalType = "\u00FF\u00FA\u0018\u0000VT100\u00FF\u00F0";
        assertThat(LineDecoder.decode(terminalType + "say hi")).isEqualTo("say hi");
    }

    @Test
    void backspaceRemovesThePreviousCharacter() {
        assertThat(LineDecoder.decode("loxk\b\bok")).isEqualTo("look");
        assertThat(LineDecoder.decode("\b\u007Fnorth")).isEqualTo("north");
    }

    @Test
    void utf8IsDecodedAndBackspacedPerCharacter() {
        String cafe = latin1Bytes("café");
        assertThat(LineDecoder.decode(cafe)).isEqualTo("café");
        assertThat(LineDecoder.decode(cafe + "\b")).isEqualTo("caf");
    }

    private static String latin1Bytes(String text) {
        return new String(text.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
    }
}
