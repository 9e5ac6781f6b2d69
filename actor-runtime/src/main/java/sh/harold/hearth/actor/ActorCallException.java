package sh.harold.hearth.actor;

import java.time.Duration;

/**
 * A synchronous call to an actor did not produce an answer.
 */
public class ActorCallException extends RuntimeException {

    public enum Failure {
        TIMEOUT,
        TERMINATED,
        INTERRUPTED,
        REJECTED
    }

    private final Failure failure;

    public ActorCallException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public static ActorCallException timeout(String actorName, Duration timeout) {
        return new ActorCallException(Failure.TIMEOUT,
                "Call to " + actorName + " timed out after " + timeout.toMillis() + "ms", null);
    }

    public static ActorCallException terminated(String actorName, ExitReason reason) {
        return new ActorCallException(Failure.TERMINATED,
                actorName + " is not running: " + reason.describe(), reason.cause());
    }

    public static ActorCallException interrupted(String actorName, InterruptedException cause) {
        return new ActorCallException(Failure.INTERRUPTED, "Interrupted while calling " + actorName, cause);
    }

    public static ActorCallException rejected(String actorName, Throwable cause) {
        return new ActorCallException(Failure.REJECTED,
                "Call to " + actorName + " failed: " + cause.getMessage(), cause);
    }

    public Failure getFailure() {
        return failure;
    }
}
