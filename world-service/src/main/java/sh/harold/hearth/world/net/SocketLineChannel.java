package sh.harold.hearth.world.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * {@link LineChannel} over a TCP socket speaking plain telnet.
 */
public final class SocketLineChannel implements LineChannel {
    private static final Logger LOGGER = LoggerFactory.getLogger(SocketLineChannel.class);

    private final Socket socket;
    private final BoundedLineReader reader;
    private final OutputStream out;
    private final String label;

    public SocketLineChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BoundedLineReader(
                new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1)),
                BoundedLineReader.DEFAULT_MAX_LINE_LENGTH);
        this.out = socket.getOutputStream();
        this.label = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public String readLine() throws IOException {
        return LineDecoder.decode(reader.readLine());
    }

    @Override
    public void write(String text) throws IOException {
        String normalized = text.replace("\r\n", "\n").replace("\n", "\r\n");
        synchronized (out) {
            out.write(normalized.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing socket {}: {}", label, e.getMessage());
        }
    }

    @Override
    public String describe() {
        return label;
    }
}
