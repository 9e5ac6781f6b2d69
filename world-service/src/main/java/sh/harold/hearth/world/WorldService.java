package sh.harold.hearth.world;

import ch.qos.logback.classic.Level;
import org.fusesource.jansi.AnsiConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.world.command.GameHandler;
import sh.harold.hearth.world.command.LoginHandler;
import sh.harold.hearth.world.command.PasswordHandler;
import sh.harold.hearth.world.config.WorldConfig;
import sh.harold.hearth.world.config.WorldConfigLoader;
import sh.harold.hearth.world.console.CommandRegistry;
import sh.harold.hearth.world.console.InteractiveConsole;
import sh.harold.hearth.world.console.commands.DebugCommand;
import sh.harold.hearth.world.console.commands.HelpCommand;
import sh.harold.hearth.world.console.commands.RoomsCommand;
import sh.harold.hearth.world.console.commands.StatusCommand;
import sh.harold.hearth.world.console.commands.StopCommand;
import sh.harold.hearth.world.console.commands.WallCommand;
import sh.harold.hearth.world.console.commands.WhoCommand;
import sh.harold.hearth.world.game.GameRegistry;
import sh.harold.hearth.world.net.SessionFactory;
import sh.harold.hearth.world.net.WorldServer;
import sh.harold.hearth.world.room.FileRoomStore;
import sh.harold.hearth.world.room.RoomManager;
import sh.harold.hearth.world.room.RoomResult;
import sh.harold.hearth.world.room.RoomStore;
import sh.harold.hearth.world.session.SessionActor;
import sh.harold.hearth.world.user.InMemoryAccountStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone world server: wires the shared services, accepts players over TCP
 * and offers an operator console.
 */
public class WorldService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorldService.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final WorldConfig config;
    private final ActorRuntime runtime;
    private final WorldServices services;
    private final WorldServer server;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean debugMode;
    private volatile Instant startedAt = Instant.now();
    private InteractiveConsole console;

    public WorldService(WorldConfig config) {
        this(config, new FileRoomStore(config.dataDirectory()));
    }

    public WorldService(WorldConfig config, RoomStore roomStore) {
        this.config = config;
        this.debugMode = config.debug();
        this.runtime = new ActorRuntime("hearth");
        RoomManager rooms = new RoomManager(runtime, roomStore, config.callTimeout());
        GameRegistry games = new GameRegistry(runtime, config.callTimeout());
        this.services = new WorldServices(runtime, config, rooms, games, new InMemoryAccountStore());
        this.server = new WorldServer(runtime, config.port(), sessionFactory(services));
    }

    /**
     * Builds the login, password and game handler chain for new sessions.
     */
    public static SessionFactory sessionFactory(WorldServices services) {
        LoginHandler login = new LoginHandler(new PasswordHandler(new GameHandler()));
        return (lifeline, connection) -> SessionActor.create(lifeline, connection, services, login);
    }

    public static void main(String[] args) {
        WorldConfig config;
        try {
            config = new WorldConfigLoader().load(args.length > 0 ? Path.of(args[0]) : null);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        new WorldService(config).start();
    }

    /**
     * Starts everything and blocks until {@link #shutdown()}.
     */
    public void start() {
        AnsiConsole.systemInstall();
        displayBanner();
        try {
            startServices();
            if (config.consoleEnabled()) {
                CommandRegistry commandRegistry = new CommandRegistry();
                registerCommands(commandRegistry);
                console = new InteractiveConsole(commandRegistry);
                console.start();
            }
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "World-Shutdown"));
            LOGGER.info("World started, type 'help' for console commands");
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
        } catch (Exception e) {
            LOGGER.error("Failed to start the world", e);
            shutdown();
            System.exit(1);
        }
    }

    /**
     * Verifies the start room and opens the listener, without blocking.
     *
     * @throws IllegalStateException if the configured start room cannot be loaded
     */
    public void startServices() throws IOException {
        applyLogLevel();
        LOGGER.info("Data directory: {}", config.dataDirectory().toAbsolutePath());
        LOGGER.info("Supervision: living={}, user={}", config.livingPolicy(), config.userPolicy());

        RoomResult startRoom = services.rooms().getRoom(config.startRoom());
        if (!startRoom.isFound()) {
            throw new IllegalStateException("Start room '" + config.startRoom() + "' could not be loaded");
        }
        server.start();
        startedAt = Instant.now();
    }

    public void registerCommands(CommandRegistry commandRegistry) {
        commandRegistry.registerCommand(new HelpCommand(commandRegistry));
        commandRegistry.registerCommand(new StatusCommand(this));
        commandRegistry.registerCommand(new WhoCommand(services.games()));
        commandRegistry.registerCommand(new RoomsCommand(services.rooms()));
        commandRegistry.registerCommand(new WallCommand(services.games()));
        commandRegistry.registerCommand(new DebugCommand(this));
        commandRegistry.registerCommand(new StopCommand(this));
    }

    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down the world...");
        try {
            if (console != null) {
                console.stop();
            }
            server.close();
            runtime.shutdown(SHUTDOWN_GRACE);
            LOGGER.info("World shut down");
        } catch (Exception e) {
            LOGGER.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
            AnsiConsole.systemUninstall();
        }
    }

    /**
     * @return the new state
     */
    public boolean toggleDebugMode() {
        debugMode = !debugMode;
        applyLogLevel();
        LOGGER.info("Debug mode {}", debugMode ? "ENABLED" : "DISABLED");
        return debugMode;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public WorldServices services() {
        return services;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public int boundPort() {
        return server.boundPort();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private void applyLogLevel() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(debugMode ? Level.DEBUG : Level.INFO);
        }
    }

    private void displayBanner() {
        System.out.println();
        System.out.println("  #    # ###### #####  ####  ##### #    #");
        System.out.println("  #    # #      #   # #    #   #   #    #");
        System.out.println("  ###### #####  ##### ######   #   ######");
        System.out.println("  #    # #      #   # #  #     #   #    #");
        System.out.println("  #    # ###### #   # #   #    #   #    #");
        System.out.println();
        System.out.println("        Hearth multiplayer world server");
        System.out.println();
        System.out.println("===============================================");
        System.out.println();
    }
}
