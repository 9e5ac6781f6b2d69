package sh.harold.hearth.world.config;

/**
 * What a user does when its living crashes.
 */
public enum LivingFailurePolicy {
    /** The whole chain up to the connection goes down. */
    DISCONNECT,
    /** The user spawns a fresh living in the last known room. */
    RESPAWN;

    public static LivingFailurePolicy parse(String raw) {
        return FailurePolicies.parse(LivingFailurePolicy.class, raw, "supervision.living");
    }
}
