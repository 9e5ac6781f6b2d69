package sh.harold.hearth.world.session;

/**
 * Lifecycle phases of a player session.
 *
 * @author Harold
 * @since 1.0.0
 */
public enum SessionPhase {

    /**
     * Transport is up, nothing shown yet.
     * Valid transitions: AWAITING_AUTH, TERMINATED
     */
    CONNECTED("Connection accepted"),

    /**
     * Login or password prompt is active.
     * Valid transitions: IN_GAME, TERMINATED
     */
    AWAITING_AUTH("Waiting for credentials"),

    /**
     * A user and its living are running.
     * Valid transitions: AWAITING_AUTH, TERMINATED
     */
    IN_GAME("Playing"),

    /**
     * The session is gone.
     */
    TERMINATED("Session ended");

    private final String description;

    SessionPhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
