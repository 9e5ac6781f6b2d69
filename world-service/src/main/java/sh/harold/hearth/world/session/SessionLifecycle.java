package sh.harold.hearth.world.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guards the phase transitions of one session. Owned by the session actor, so
 * writes come from one thread; the current phase may be read from anywhere.
 */
public final class SessionLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionLifecycle.class);

    private static final Map<SessionPhase, Set<SessionPhase>> VALID_TRANSITIONS;

    static {
        Map<SessionPhase, Set<SessionPhase>> transitions = new EnumMap<>(SessionPhase.class);
        transitions.put(SessionPhase.CONNECTED, EnumSet.of(SessionPhase.AWAITING_AUTH, SessionPhase.TERMINATED));
        transitions.put(SessionPhase.AWAITING_AUTH, EnumSet.of(SessionPhase.IN_GAME, SessionPhase.TERMINATED));
        transitions.put(SessionPhase.IN_GAME, EnumSet.of(SessionPhase.AWAITING_AUTH, SessionPhase.TERMINATED));
        transitions.put(SessionPhase.TERMINATED, EnumSet.noneOf(SessionPhase.class));
        VALID_TRANSITIONS = transitions;
    }

    private final String sessionName;
    private volatile SessionPhase current = SessionPhase.CONNECTED;

    public SessionLifecycle(String sessionName) {
        this.sessionName = sessionName;
    }

    public SessionPhase current() {
        return current;
    }

    /**
     * @return false, leaving the phase unchanged, when the move is not allowed
     */
    public boolean transitionTo(SessionPhase next, String reason) {
        SessionPhase from = current;
        if (!isValidTransition(from, next)) {
            LOGGER.warn("Session {} refused phase change {} -> {} ({})", sessionName, from, next, reason);
            return false;
        }
        current = next;
        LOGGER.debug("Session {}: {} -> {} ({})", sessionName, from, next, reason);
        return true;
    }

    public static boolean isValidTransition(SessionPhase from, SessionPhase to) {
        Set<SessionPhase> targets = VALID_TRANSITIONS.get(from);
        return targets != null && targets.contains(to);
    }
}
