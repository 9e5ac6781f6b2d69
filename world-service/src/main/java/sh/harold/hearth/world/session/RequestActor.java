package sh.harold.hearth.world.session;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * Runs a single line through a handler and stops. Lives as a child of its session,
 * which learns the outcome from the request's exit reason.
 *
 * <p>The handler itself runs on the request dispatcher so that a stuck handler never
 * holds an actor thread. Stopping the request interrupts the handler.
 */
final class RequestActor extends AbstractBehavior<RequestActor.Command> {

    sealed interface Command permits Finished {
    }

    /**
     * @param failure what the handler threw, {@code null} on success
     */
    record Finished(Throwable failure) implements Command {
    }

    private final Lifeline lifeline;
    private final FutureTask<Void> work;

    private RequestActor(ActorContext<Command> context, Lifeline lifeline, HandlerFrame frame, String line,
                         RequestContext requestContext) {
        super(context);
        this.lifeline = lifeline;
        ActorRef<Command> self = context.getSelf();
        this.work = new FutureTask<>(() -> {
            frame.handler().handle(requestContext, line);
            return null;
        }) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    return;
                }
                try {
                    get();
                    self.tell(new Finished(null));
                } catch (ExecutionException e) {
                    self.tell(new Finished(e.getCause()));
                } catch (InterruptedException | CancellationException e) {
                    self.tell(new Finished(e));
                }
            }
        };
        Executor executor = context.getSystem().dispatchers()
                .lookup(DispatcherSelector.fromConfig(ActorRuntime.REQUEST_DISPATCHER));
        executor.execute(work);
    }

    static Behavior<Command> create(Lifeline lifeline, HandlerFrame frame, String line, RequestContext requestContext) {
        return Behaviors.setup(context -> new RequestActor(context, lifeline, frame, line, requestContext));
    }

    @Override
    public Receive<Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(Finished.class, finished -> {
                    if (finished.failure() != null) {
                        lifeline.exit(ExitReason.crashed(finished.failure()));
                    }
                    return Behaviors.stopped();
                })
                .onSignal(PostStop.class, signal -> {
                    work.cancel(true);
                    return this;
                })
                .build();
    }
}
