package sh.harold.hearth.world.console;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Keeps the console prompt at the bottom while log lines scroll past.
 */
public final class PromptAwarePrintStream extends PrintStream {
    private final PrintStream delegate;
    private final Object lock = new Object();
    private String prompt = "";
    private boolean promptActive;
    private boolean promptShown;

    public PromptAwarePrintStream(PrintStream delegate) {
        super(Objects.requireNonNull(delegate, "delegate"), true);
        this.delegate = delegate;
    }

    public PrintStream getDelegate() {
        return delegate;
    }

    public void showPrompt(String text) {
        synchronized (lock) {
            prompt = text;
            promptActive = true;
            delegate.print(prompt);
            delegate.flush();
            promptShown = true;
        }
    }

    public void hidePrompt() {
        synchronized (lock) {
            promptActive = false;
            promptShown = false;
        }
    }

    @Override
    public void write(int b) {
        synchronized (lock) {
            breakPromptLine();
            super.write(b);
            if (b == '\n') {
                redrawPrompt();
            }
        }
    }

    @Override
    public void write(byte[] buf, int off, int len) {
        if (len == 0) {
            return;
        }
        synchronized (lock) {
            breakPromptLine();
            super.write(buf, off, len);
            if (buf[off + len - 1] == '\n') {
                redrawPrompt();
            }
        }
    }

    private void breakPromptLine() {
        if (promptActive && promptShown) {
            delegate.println();
            promptShown = false;
        }
    }

    private void redrawPrompt() {
        if (promptActive) {
            super.flush();
            delegate.print(prompt);
            delegate.flush();
            promptShown = true;
        }
    }
}
