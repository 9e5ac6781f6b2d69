package sh.harold.hearth.world.session;

import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.WorldServices;
import sh.harold.hearth.world.living.LivingHandle;
import sh.harold.hearth.world.user.UserAccount;
import sh.harold.hearth.world.user.UserHandle;

import java.util.Objects;
import java.util.Optional;

/**
 * What a handler can reach while it processes one line.
 *
 * <p>Once the request has been cancelled, output and stack changes are dropped,
 * so a late handler cannot write past the line that follows it.
 */
public final class RequestContext {

    private final ActorHandle<SessionMessage> session;
    private final WorldServices services;
    private final HandlerFrame frame;
    private final UserHandle user;
    private final Lifeline request;

    RequestContext(ActorHandle<SessionMessage> session, WorldServices services, HandlerFrame frame, UserHandle user,
                   Lifeline request) {
        this.session = Objects.requireNonNull(session, "session");
        this.services = Objects.requireNonNull(services, "services");
        this.frame = Objects.requireNonNull(frame, "frame");
        this.user = user;
        this.request = Objects.requireNonNull(request, "request");
    }

    public boolean isActive() {
        return request.isAlive();
    }

    public WorldServices services() {
        return services;
    }

    public HandlerFrame frame() {
        return frame;
    }

    public String arg(String key) {
        return frame.arg(key);
    }

    public void write(String text) {
        send(new SessionMessage.Output(text));
    }

    public void push(HandlerFrame next) {
        send(new SessionMessage.Push(next));
    }

    public void pop() {
        send(new SessionMessage.Pop());
    }

    public void replace(HandlerFrame next) {
        send(new SessionMessage.Replace(next));
    }

    public Optional<UserHandle> user() {
        return Optional.ofNullable(user);
    }

    /**
     * @throws IllegalStateException if the session is not in the game
     */
    public LivingHandle living() {
        UserHandle current = user().orElseThrow(() -> new IllegalStateException("Not logged in"));
        LivingHandle living = current.living();
        if (living == null) {
            throw new IllegalStateException("No living for " + current.username());
        }
        return living;
    }

    /**
     * Enters the game as {@code account}. On success the session has already put {@code game}
     * in place of the current handler, so the caller must not replace it again.
     *
     * @return empty when the session already plays a user or this request was cancelled
     */
    public Optional<UserHandle> startUser(UserAccount account, HandlerFrame game) {
        Objects.requireNonNull(game, "game");
        if (!isActive()) {
            return Optional.empty();
        }
        return session.call(replyTo -> new SessionMessage.StartUser(account, game, request, replyTo),
                services.config().callTimeout());
    }

    public void logout() {
        send(new SessionMessage.Logout());
    }

    public void disconnect(String farewell) {
        send(new SessionMessage.Disconnect(farewell));
    }

    private void send(SessionMessage message) {
        if (isActive()) {
            session.tell(message);
        }
    }
}
