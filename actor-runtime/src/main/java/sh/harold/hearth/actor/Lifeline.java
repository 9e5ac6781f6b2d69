package sh.harold.hearth.actor;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exit record of one actor incarnation.
 *
 * <p>The first recorded {@link ExitReason} wins. Reading {@link #isAlive()} is a single volatile
 * read, so callers can test liveness without messaging the actor. When the actor stops without
 * having recorded a reason it inherits one from its parent: a clean parent stop becomes
 * {@link ExitReason.Kind#SHUTDOWN}, anything else becomes {@link ExitReason.Kind#LINKED}.
 */
public final class Lifeline {

    private final String name;
    private final Lifeline parent;
    private final Set<Lifeline> registry;
    private final AtomicReference<ExitReason> exit = new AtomicReference<>();
    private final CompletableFuture<ExitReason> termination = new CompletableFuture<>();

    Lifeline(String name, Lifeline parent, Set<Lifeline> registry) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
        this.registry = registry;
        registry.add(this);
    }

    /**
     * Creates the lifeline for a child actor. The child inherits this lifeline's reason when the
     * two stop together.
     */
    public Lifeline child(String childName) {
        return new Lifeline(childName, this, registry);
    }

    public String name() {
        return name;
    }

    public boolean isAlive() {
        return exit.get() == null;
    }

    public Optional<ExitReason> exitReason() {
        return Optional.ofNullable(exit.get());
    }

    /**
     * Completes once the actor has fully stopped.
     */
    public CompletableFuture<ExitReason> termination() {
        return termination;
    }

    /**
     * Records why the actor is stopping. Returns {@code false} when a reason was already recorded.
     */
    public boolean exit(ExitReason reason) {
        return exit.compareAndSet(null, Objects.requireNonNull(reason, "reason"));
    }

    void terminated() {
        exit.compareAndSet(null, resolve());
        registry.remove(this);
        termination.complete(exit.get());
    }

    private ExitReason resolve() {
        ExitReason recorded = exit.get();
        if (recorded != null) {
            return recorded;
        }
        if (parent == null) {
            return ExitReason.shutdown("actor system terminated");
        }
        ExitReason parentReason = parent.resolve();
        if (parentReason.isNormal()) {
            return ExitReason.shutdown("parent " + parent.name + " stopped");
        }
        return ExitReason.linked(parent.name, parentReason);
    }

    @Override
    public String toString() {
        ExitReason reason = exit.get();
        return name + (reason == null ? " (alive)" : " (" + reason.describe() + ")");
    }
}
