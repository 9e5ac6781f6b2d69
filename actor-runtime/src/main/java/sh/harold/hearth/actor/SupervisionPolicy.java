package sh.harold.hearth.actor;

/**
 * What a watcher does when an actor it watches terminates.
 */
public enum SupervisionPolicy {

    /**
     * Fate-sharing: an abnormal exit of the watched actor terminates the watcher
     * with {@link ExitReason.Kind#LINKED}. Normal exits are ignored.
     */
    PROPAGATE,

    /**
     * Trapping: the watcher is told about every exit and keeps running.
     */
    ABSORB;

    /**
     * Whether a watcher under this policy must stop after the watched actor exited for {@code reason}.
     */
    public boolean stopsWatcher(ExitReason reason) {
        return this == PROPAGATE && reason.isAbnormal();
    }
}
