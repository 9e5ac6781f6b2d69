package sh.harold.hearth.world.session;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.user.UserAccount;
import sh.harold.hearth.world.user.UserHandle;

import java.util.Optional;

/**
 * Messages understood by a session actor.
 */
public sealed interface SessionMessage {

    /**
     * A line read from the connection.
     */
    record Input(String line) implements SessionMessage {
    }

    /**
     * Text for the player.
     */
    record Output(String text) implements SessionMessage {
    }

    record Push(HandlerFrame frame) implements SessionMessage {
    }

    record Pop() implements SessionMessage {
    }

    record Replace(HandlerFrame frame) implements SessionMessage {
    }

    /**
     * Spawns the user for an authenticated account and, in the same step, swaps the
     * handler on top of the stack for {@code game}. Answers empty when this session
     * already plays a user or when {@code request} is no longer running.
     */
    record StartUser(UserAccount account, HandlerFrame game, Lifeline request,
                     ActorRef<Optional<UserHandle>> replyTo) implements SessionMessage {
    }

    /**
     * Ends the current user and returns to the login prompt.
     */
    record Logout() implements SessionMessage {
    }

    /**
     * Says goodbye and closes the connection.
     */
    record Disconnect(String farewell) implements SessionMessage {
    }

    record GetPhase(ActorRef<SessionPhase> replyTo) implements SessionMessage {
    }

    /**
     * Death notice for the request running line number {@code sequence}.
     */
    record RequestExited(long sequence) implements SessionMessage {
    }

    /**
     * Watchdog tick for the request running line number {@code sequence}.
     */
    record RequestTimedOut(long sequence) implements SessionMessage {
    }

    /**
     * Death notice for the session's user.
     */
    record UserExited(UserHandle user) implements SessionMessage {
    }
}
