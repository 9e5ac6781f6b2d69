package sh.harold.hearth.actor;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Why an actor stopped running.
 *
 * <p>Only {@link Kind#NORMAL} exits are ignored by {@link SupervisionPolicy#PROPAGATE}
 * watchers; every other kind tears down propagating peers.
 *
 * @author Harold
 * @since 1.0.0
 */
public record ExitReason(Kind kind, String detail, Throwable cause) {

    public enum Kind {
        /** The actor finished its work and stopped itself. */
        NORMAL,
        /** The actor was asked to shut down, or its transport went away. */
        SHUTDOWN,
        /** Forced termination from outside the actor. */
        KILLED,
        /** Forced termination by a watchdog. */
        TIMEOUT,
        /** An exception escaped one of the actor callbacks. */
        CRASHED,
        /** A propagating peer exited abnormally. */
        LINKED
    }

    public ExitReason {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }

    public static ExitReason normal() {
        return new ExitReason(Kind.NORMAL, "normal", null);
    }

    public static ExitReason shutdown(String detail) {
        return new ExitReason(Kind.SHUTDOWN, detail, null);
    }

    public static ExitReason killed(String detail) {
        return new ExitReason(Kind.KILLED, detail, null);
    }

    public static ExitReason timeout(String detail) {
        return new ExitReason(Kind.TIMEOUT, detail, null);
    }

    public static ExitReason crashed(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ExitReason(Kind.CRASHED, message, cause);
    }

    public static ExitReason linked(String peer, ExitReason peerReason) {
        return new ExitReason(Kind.LINKED, peer + " exited: " + peerReason.describe(), peerReason.cause());
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    public boolean isAbnormal() {
        return kind != Kind.NORMAL;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(cause);
    }

    public String describe() {
        return kind.name().toLowerCase(Locale.ROOT) + (detail.isEmpty() ? "" : " (" + detail + ")");
    }

    @Override
    public String toString() {
        return describe();
    }
}
