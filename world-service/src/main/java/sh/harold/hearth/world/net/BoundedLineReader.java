package sh.harold.hearth.world.net;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads lines like {@link java.io.BufferedReader#readLine()}, accepting {@code \n}, {@code \r}
 * or {@code \r\n} as terminators, but refuses lines longer than a fixed limit instead of
 * buffering them without bound.
 */
final class BoundedLineReader {

    static final int DEFAULT_MAX_LINE_LENGTH = 4096;

    private final Reader in;
    private final int maxLineLength;
    private boolean skipLineFeed;

    BoundedLineReader(Reader in, int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        this.in = in;
        this.maxLineLength = maxLineLength;
    }

    /**
     * @return the next line without its terminator, {@code null} at end of stream
     * @throws IOException when the line runs past the limit, or on a read failure
     */
    String readLine() throws IOException {
        StringBuilder line = new StringBuilder();
        while (true) {
            int c = in.read();
            if (c == -1) {
                return line.length() > 0 ? line.toString() : null;
            }
            if (skipLineFeed) {
                skipLineFeed = false;
                if (c == '\n') {
                    continue;
                }
            }
            if (c == '\n') {
                return line.toString();
            }
            if (c == '\r') {
                skipLineFeed = true;
                return line.toString();
            }
            if (line.length() >= maxLineLength) {
                throw new IOException("line longer than " + maxLineLength + " characters");
            }
            line.append((char) c);
        }
    }
}
