package sh.harold.hearth.world.user;

import java.util.Objects;

/**
 * A registered player.
 *
 * @param passwordHash salted hash in the form {@code salt$digest}, both hex encoded
 */
public record UserAccount(String username, String passwordHash) {

    public UserAccount {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(passwordHash, "passwordHash");
    }

    @Override
    public String toString() {
        return "UserAccount{" + username + "}";
    }
}
