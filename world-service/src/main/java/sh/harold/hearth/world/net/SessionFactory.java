package sh.harold.hearth.world.net;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.session.SessionMessage;

/**
 * Creates the session behavior for a freshly accepted connection.
 */
@FunctionalInterface
public interface SessionFactory {

    Behavior<SessionMessage> create(Lifeline lifeline, ActorRef<ConnectionMessage> connection);
}
