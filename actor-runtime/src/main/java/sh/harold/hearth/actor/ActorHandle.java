package sh.harold.hearth.actor;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Scheduler;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.AskPattern;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * A Pekko {@link ActorRef} paired with the {@link Lifeline} of the incarnation it points at.
 *
 * <p>Handles compare by their reference, so two handles to the same actor are equal.
 *
 * @param <M> the message protocol of the actor
 */
public final class ActorHandle<M> {

    private final ActorRef<M> ref;
    private final Lifeline lifeline;
    private final Scheduler scheduler;

    public ActorHandle(ActorRef<M> ref, Lifeline lifeline, Scheduler scheduler) {
        this.ref = Objects.requireNonNull(ref, "ref");
        this.lifeline = Objects.requireNonNull(lifeline, "lifeline");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * The handle an actor hands out for itself.
     */
    public static <M> ActorHandle<M> self(ActorContext<M> context, Lifeline lifeline) {
        return new ActorHandle<>(context.getSelf(), lifeline, context.getSystem().scheduler());
    }

    public ActorRef<M> ref() {
        return ref;
    }

    public Lifeline lifeline() {
        return lifeline;
    }

    public String name() {
        return lifeline.name();
    }

    public String path() {
        return ref.path().toString();
    }

    public void tell(M message) {
        ref.tell(message);
    }

    public boolean isAlive() {
        return lifeline.isAlive();
    }

    public Optional<ExitReason> exitReason() {
        return lifeline.exitReason();
    }

    public CompletableFuture<ExitReason> termination() {
        return lifeline.termination();
    }

    /**
     * Sends a request built around a reply address and blocks until the reply arrives.
     *
     * <p>Fails fast when the actor is already gone, and stops waiting as soon as the actor
     * terminates instead of sitting out the timeout.
     *
     * @throws ActorCallException on timeout, termination, interruption, or a failed reply
     */
    public <R> R call(Function<ActorRef<R>, M> request, Duration timeout) {
        ExitReason dead = lifeline.exitReason().orElse(null);
        if (dead != null) {
            throw ActorCallException.terminated(name(), dead);
        }
        CompletableFuture<R> reply = AskPattern.<M, R>ask(ref, request::apply, timeout, scheduler)
                .toCompletableFuture();
        try {
            CompletableFuture.anyOf(reply, lifeline.termination()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply.cancel(false);
            throw ActorCallException.interrupted(name(), e);
        } catch (ExecutionException e) {
            // reported through the reply below
        }
        if (!reply.isDone()) {
            throw ActorCallException.terminated(name(), lifeline.termination().join());
        }
        try {
            return reply.join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw ActorCallException.timeout(name(), timeout);
            }
            throw ActorCallException.rejected(name(), cause);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ActorHandle<?> other && ref.equals(other.ref);
    }

    @Override
    public int hashCode() {
        return ref.hashCode();
    }

    @Override
    public String toString() {
        return lifeline.toString();
    }
}
