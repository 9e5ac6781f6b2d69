package sh.harold.hearth.world.net;

import java.io.IOException;

/**
 * Messages understood by a connection actor.
 */
public sealed interface ConnectionMessage {

    /**
     * @param newline false for prompts, which stay on the input line
     */
    record Write(String text, boolean newline) implements ConnectionMessage {
    }

    record Close(String reason) implements ConnectionMessage {
    }

    /**
     * Sent by the reader thread once the peer stopped sending.
     *
     * @param cause {@code null} on a clean end of stream
     */
    record InputClosed(IOException cause) implements ConnectionMessage {
    }

    /**
     * Death notice for the session this connection carries.
     */
    record SessionExited() implements ConnectionMessage {
    }
}
