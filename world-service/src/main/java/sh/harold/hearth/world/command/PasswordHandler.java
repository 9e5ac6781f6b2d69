package sh.harold.hearth.world.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.world.session.HandlerFrame;
import sh.harold.hearth.world.session.InputHandler;
import sh.harold.hearth.world.session.RequestContext;
import sh.harold.hearth.world.user.UserAccount;
import sh.harold.hearth.world.user.UserHandle;

import java.util.Objects;
import java.util.Optional;

/**
 * Checks or sets the password for the name on the frame, then enters the game.
 */
public final class PasswordHandler implements InputHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PasswordHandler.class);

    static final String USERNAME = "username";
    static final String MODE = "mode";
    static final String MODE_EXISTING = "existing";
    static final String MODE_NEW = "new";
    static final int MIN_PASSWORD_LENGTH = 4;

    private final GameHandler gameHandler;

    public PasswordHandler(GameHandler gameHandler) {
        this.gameHandler = Objects.requireNonNull(gameHandler, "gameHandler");
    }

    @Override
    public void handle(RequestContext context, String line) {
        String username = context.arg(USERNAME);
        String password = line.trim();

        UserAccount account;
        if (MODE_NEW.equals(context.arg(MODE))) {
            if (password.length() < MIN_PASSWORD_LENGTH) {
                context.write("Passwords need at least " + MIN_PASSWORD_LENGTH + " characters.");
                return;
            }
            try {
                account = context.services().accounts().create(username, password);
            } catch (IllegalStateException e) {
                context.write("Someone just claimed that name.");
                context.pop();
                return;
            }
        } else {
            Optional<UserAccount> authenticated = context.services().accounts().authenticate(username, password);
            if (authenticated.isEmpty()) {
                LOGGER.info("Failed login for {}", username);
                context.write("Wrong password.");
                context.pop();
                return;
            }
            account = authenticated.get();
        }

        if (context.services().games().isOnline(account.username())) {
            context.write("You are already playing.");
            context.pop();
            return;
        }

        Optional<UserHandle> user = context.startUser(account, HandlerFrame.of(gameHandler));
        if (user.isEmpty()) {
            context.write("You are already playing.");
            context.pop();
            return;
        }
        context.write("Welcome, " + account.username() + ".");
        context.write(user.get().living().look());
    }

    @Override
    public String prompt(HandlerFrame frame) {
        return MODE_NEW.equals(frame.arg(MODE)) ? "Choose a password: " : "Password: ";
    }
}
