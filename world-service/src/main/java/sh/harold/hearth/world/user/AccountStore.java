package sh.harold.hearth.world.user;

import java.util.Optional;

/**
 * Account lookup and credential checks. Usernames are matched case-insensitively.
 */
public interface AccountStore {

    Optional<UserAccount> find(String username);

    /**
     * @throws IllegalStateException if the name is taken
     */
    UserAccount create(String username, String password);

    /**
     * @return the account when the password matches
     */
    Optional<UserAccount> authenticate(String username, String password);

    int size();
}
