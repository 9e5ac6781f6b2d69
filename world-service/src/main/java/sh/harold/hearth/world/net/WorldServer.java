package sh.harold.hearth.world.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorRuntime;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accepts TCP clients and spawns a {@link ConnectionActor} for each.
 */
public final class WorldServer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorldServer.class);

    private final ActorRuntime runtime;
    private final int port;
    private final SessionFactory sessionFactory;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ServerSocket serverSocket;
    private Thread acceptor;

    public WorldServer(ActorRuntime runtime, int port, SessionFactory sessionFactory) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.port = port;
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(port));
        acceptor = new Thread(this::acceptLoop, "World-Acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        LOGGER.info("Listening for players on port {}", boundPort());
    }

    /**
     * The port actually bound, useful when started with port 0.
     */
    public int boundPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing server socket", e);
        }
        LOGGER.info("Stopped accepting players");
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    LOGGER.error("Error accepting connection", e);
                }
                continue;
            }
            try {
                socket.setTcpNoDelay(true);
                SocketLineChannel channel = new SocketLineChannel(socket);
                runtime.spawn("connection:" + channel.describe(), ConnectionMessage.class,
                        lifeline -> ConnectionActor.create(lifeline, channel, sessionFactory),
                        ActorRuntime.blocking());
            } catch (IOException | IllegalStateException e) {
                LOGGER.warn("Dropping connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }
}
