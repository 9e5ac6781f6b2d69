package sh.harold.hearth.world.net;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.session.SessionMessage;

import java.io.IOException;
import java.util.Objects;

/**
 * Owns one transport. A dedicated reader thread forwards input lines to the
 * session; output is written from the actor itself.
 *
 * <p>The session is a child: it dies with the connection, and any session exit
 * closes the connection. End of input stops the connection with
 * {@link ExitReason.Kind#SHUTDOWN}, which in turn takes the session, its user and
 * the user's living down.
 */
public final class ConnectionActor extends AbstractBehavior<ConnectionMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionActor.class);

    private final Lifeline lifeline;
    private final LineChannel channel;
    private final ActorHandle<SessionMessage> session;
    private final Thread reader;

    private ConnectionActor(ActorContext<ConnectionMessage> context, Lifeline lifeline, LineChannel channel,
                            SessionFactory sessionFactory) {
        super(context);
        this.lifeline = lifeline;
        this.channel = channel;
        ActorRef<ConnectionMessage> self = context.getSelf();
        this.session = ActorRuntime.spawnChild(context, lifeline, "session", SessionMessage.class,
                sessionLifeline -> sessionFactory.create(sessionLifeline, self));
        context.watchWith(session.ref(), new ConnectionMessage.SessionExited());
        this.reader = new Thread(() -> readLoop(self), "Connection-Reader-" + channel.describe());
        reader.setDaemon(true);
        reader.start();
        LOGGER.info("Connection opened from {}", channel.describe());
    }

    public static Behavior<ConnectionMessage> create(Lifeline lifeline, LineChannel channel, SessionFactory sessionFactory) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(sessionFactory, "sessionFactory");
        return Behaviors.setup(context -> new ConnectionActor(context, lifeline, channel, sessionFactory));
    }

    @Override
    public Receive<ConnectionMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(ConnectionMessage.Write.class, this::onWrite)
                .onMessage(ConnectionMessage.Close.class, close -> stop(ExitReason.shutdown(close.reason())))
                .onMessage(ConnectionMessage.InputClosed.class, closed -> {
                    String detail = closed.cause() == null
                            ? "peer closed the connection"
                            : "read failed: " + closed.cause().getMessage();
                    return stop(ExitReason.shutdown(detail));
                })
                .onMessage(ConnectionMessage.SessionExited.class, exited -> {
                    ExitReason reason = session.exitReason().orElse(ExitReason.shutdown("session stopped"));
                    return stop(reason.isNormal()
                            ? ExitReason.shutdown("session ended")
                            : ExitReason.linked(session.name(), reason));
                })
                .onSignal(PostStop.class, signal -> {
                    channel.close();
                    reader.interrupt();
                    LOGGER.info("Connection {} closed: {}", channel.describe(),
                            lifeline.exitReason().map(ExitReason::describe).orElse("stopped"));
                    return this;
                })
                .build();
    }

    private Behavior<ConnectionMessage> onWrite(ConnectionMessage.Write write) {
        try {
            channel.write(write.newline() ? write.text() + "\n" : write.text());
            return this;
        } catch (IOException e) {
            LOGGER.debug("Write to {} failed: {}", channel.describe(), e.getMessage());
            return stop(ExitReason.shutdown("write failed: " + e.getMessage()));
        }
    }

    private Behavior<ConnectionMessage> stop(ExitReason reason) {
        lifeline.exit(reason);
        return Behaviors.stopped();
    }

    private void readLoop(ActorRef<ConnectionMessage> self) {
        try {
            String line;
            while ((line = channel.readLine()) != null) {
                if (!lifeline.isAlive()) {
                    return;
                }
                session.tell(new SessionMessage.Input(line));
            }
            self.tell(new ConnectionMessage.InputClosed(null));
        } catch (IOException e) {
            if (lifeline.isAlive()) {
                self.tell(new ConnectionMessage.InputClosed(e));
            }
        }
    }
}
