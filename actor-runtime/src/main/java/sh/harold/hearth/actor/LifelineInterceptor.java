package sh.harold.hearth.actor;

import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.BehaviorInterceptor;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.Signal;
import org.apache.pekko.actor.typed.TypedActorContext;

/**
 * Keeps a {@link Lifeline} in step with the behavior it wraps: failures are recorded as crashes,
 * a returned stopped behavior without a recorded reason counts as a normal exit, and
 * {@link PostStop} completes the termination future.
 */
final class LifelineInterceptor<M> extends BehaviorInterceptor<M, M> {

    private final Lifeline lifeline;

    LifelineInterceptor(Class<M> protocol, Lifeline lifeline) {
        super(protocol);
        this.lifeline = lifeline;
    }

    @Override
    public Behavior<M> aroundStart(TypedActorContext<M> context, BehaviorInterceptor.PreStartTarget<M> target) {
        try {
            return observe(target.start(context));
        } catch (RuntimeException | Error e) {
            // PostStop is never delivered to a behavior that failed to start
            lifeline.exit(ExitReason.crashed(e));
            lifeline.terminated();
            throw e;
        }
    }

    @Override
    public Behavior<M> aroundReceive(TypedActorContext<M> context, M message, BehaviorInterceptor.ReceiveTarget<M> target) {
        try {
            return observe(target.apply(context, message));
        } catch (RuntimeException | Error e) {
            lifeline.exit(ExitReason.crashed(e));
            throw e;
        }
    }

    @Override
    public Behavior<M> aroundSignal(TypedActorContext<M> context, Signal signal, BehaviorInterceptor.SignalTarget<M> target) {
        if (signal instanceof PostStop) {
            try {
                return target.apply(context, signal);
            } finally {
                lifeline.terminated();
            }
        }
        try {
            return observe(target.apply(context, signal));
        } catch (RuntimeException | Error e) {
            lifeline.exit(ExitReason.crashed(e));
            throw e;
        }
    }

    private Behavior<M> observe(Behavior<M> next) {
        if (!Behavior.isAlive(next)) {
            lifeline.exit(ExitReason.normal());
        }
        return next;
    }
}
