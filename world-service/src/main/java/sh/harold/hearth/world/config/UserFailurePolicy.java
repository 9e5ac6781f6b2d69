package sh.harold.hearth.world.config;

/**
 * What a session does when its user crashes.
 */
public enum UserFailurePolicy {
    /** The session and its connection go down with the user. */
    DISCONNECT,
    /** The session survives and returns to the login prompt. */
    REAUTHENTICATE;

    public static UserFailurePolicy parse(String raw) {
        return FailurePolicies.parse(UserFailurePolicy.class, raw, "supervision.user");
    }
}
