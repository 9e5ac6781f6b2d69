package sh.harold.hearth.world.net;

import java.io.Closeable;
import java.io.IOException;

/**
 * Line-oriented, bidirectional text transport.
 */
public interface LineChannel extends Closeable {

    /**
     * Blocks until a full line arrived.
     *
     * @return the line without its terminator, {@code null} at end of stream
     */
    String readLine() throws IOException;

    void write(String text) throws IOException;

    /**
     * Closes the transport. Unblocks a pending {@link #readLine()}.
     */
    @Override
    void close();

    /**
     * Short label for logs, typically the remote address.
     */
    String describe();
}
