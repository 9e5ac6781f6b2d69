package sh.harold.hearth.world.session;

/**
 * Interprets one line of player input. The handler on top of a session's stack
 * receives each line, inside a request actor of its own.
 */
public interface InputHandler {

    /**
     * Handles {@code line}. Thrown exceptions end the request, not the session.
     */
    void handle(RequestContext context, String line) throws Exception;

    /**
     * Prompt shown while this handler is on top of the stack.
     */
    default String prompt(HandlerFrame frame) {
        return "> ";
    }
}
