package sh.harold.hearth.world.command;

import sh.harold.hearth.world.session.HandlerFrame;
import sh.harold.hearth.world.session.InputHandler;
import sh.harold.hearth.world.session.RequestContext;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Asks for a name and hands over to the {@link PasswordHandler}.
 */
public final class LoginHandler implements InputHandler {

    static final Pattern VALID_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{1,15}");

    private final PasswordHandler passwordHandler;

    public LoginHandler(PasswordHandler passwordHandler) {
        this.passwordHandler = Objects.requireNonNull(passwordHandler, "passwordHandler");
    }

    @Override
    public void handle(RequestContext context, String line) {
        String name = line.trim();
        if (name.isEmpty()) {
            return;
        }
        if (name.equalsIgnoreCase("quit")) {
            context.disconnect("Goodbye.");
            return;
        }
        if (!VALID_NAME.matcher(name).matches()) {
            context.write("Names are 2 to 16 letters, digits or underscores, starting with a letter.");
            return;
        }

        boolean existing = context.services().accounts().find(name).isPresent();
        if (!existing) {
            context.write("Welcome, newcomer. Pick a password for " + name + ".");
        }
        context.push(HandlerFrame.of(passwordHandler)
                .with(PasswordHandler.USERNAME, name)
                .with(PasswordHandler.MODE, existing ? PasswordHandler.MODE_EXISTING : PasswordHandler.MODE_NEW));
    }

    @Override
    public String prompt(HandlerFrame frame) {
        return "By what name are you known? ";
    }
}
