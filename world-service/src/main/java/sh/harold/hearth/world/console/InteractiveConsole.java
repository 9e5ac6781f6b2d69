package sh.harold.hearth.world.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator console reading commands from standard input.
 */
public class InteractiveConsole implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(InteractiveConsole.class);
    private static final String PROMPT = "world> ";

    private final CommandRegistry commandRegistry;
    private final InputStream input;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consoleThread;
    private PromptAwarePrintStream promptStream;
    private PrintStream originalOut;

    public InteractiveConsole(CommandRegistry commandRegistry) {
        this(commandRegistry, System.in);
    }

    public InteractiveConsole(CommandRegistry commandRegistry, InputStream input) {
        this.commandRegistry = Objects.requireNonNull(commandRegistry, "commandRegistry");
        this.input = Objects.requireNonNull(input, "input");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            consoleThread = new Thread(this, "World-Console");
            consoleThread.setDaemon(true);
            consoleThread.start();
            LOGGER.info("Interactive console started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consoleThread != null) {
                consoleThread.interrupt();
            }
            LOGGER.info("Interactive console stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void run() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        installPromptStream();
        System.out.println("Hearth world console. Type 'help' for available commands.");

        try {
            while (running.get()) {
                promptStream.showPrompt(PROMPT);
                String line = reader.readLine();
                promptStream.hidePrompt();
                if (line == null) {
                    break;
                }
                if (!line.isBlank()) {
                    commandRegistry.executeCommand(line);
                }
            }
        } catch (IOException e) {
            if (running.get()) {
                LOGGER.error("Error reading console input", e);
            }
        } finally {
            restoreOriginalStream();
            running.set(false);
        }
    }

    private void installPromptStream() {
        PrintStream current = System.out;
        if (current instanceof PromptAwarePrintStream existing) {
            promptStream = existing;
            return;
        }
        originalOut = current;
        promptStream = new PromptAwarePrintStream(current);
        System.setOut(promptStream);
    }

    private void restoreOriginalStream() {
        promptStream.hidePrompt();
        if (originalOut != null && System.out == promptStream) {
            System.setOut(originalOut);
        }
    }
}
