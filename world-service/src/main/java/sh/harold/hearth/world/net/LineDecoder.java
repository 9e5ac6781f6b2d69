package sh.harold.hearth.world.net;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Cleans a raw telnet line: strips IAC command sequences and carriage returns,
 * applies backspaces, and decodes the remaining bytes as UTF-8.
 *
 * <p>Input is expected as ISO-8859-1 text, one char per received byte.
 */
public final class LineDecoder {

    static final int IAC = 255;
    static final int SB = 250;
    static final int SE = 240;
    static final int WILL = 251;
    static final int DONT = 254;

    private LineDecoder() {
    }

    public static String decode(String raw) {
        if (raw == null) {
            return null;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(raw.length());
        int i = 0;
        while (i < raw.length()) {
            int b = raw.charAt(i) & 0xFF;
            if (b == IAC) {
                i = skipCommand(raw, i);
                continue;
            }
            i++;
            if (b == '\r' || b == 0) {
                continue;
            }
            if (b == '\b' || b == 0x7F) {
                backspace(bytes);
                continue;
            }
            bytes.write(b);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    /**
     * @return index of the first char after the command starting at {@code start}
     */
    private static int skipCommand(String raw, int start) {
        int next = start + 1;
        if (next >= raw.length()) {
            return next;
        }
        int command = raw.charAt(next) & 0xFF;
        if (command >= WILL && command <= DONT) {
            return Math.min(next + 2, raw.length());
        }
        if (command == SB) {
            int i = next + 1;
            while (i + 1 < raw.length()) {
                if ((raw.charAt(i) & 0xFF) == IAC && (raw.charAt(i + 1) & 0xFF) == SE) {
                    return i + 2;
                }
                i++;
            }
            return raw.length();
        }
        return next + 1;
    }

    private static void backspace(ByteArrayOutputStream bytes) {
        byte[] current = bytes.toByteArray();
        int length = current.length;
        if (length == 0) {
            return;
        }
        // step back over UTF-8 continuation bytes so a whole character goes
        length--;
        while (length > 0 && (current[length] & 0xC0) == 0x80) {
            length--;
        }
        bytes.reset();
        bytes.write(current, 0, length);
    }
}
