package sh.harold.hearth.world.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local accounts with salted SHA-256 password hashes.
 */
public final class InMemoryAccountStore implements AccountStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAccountStore.class);
    private static final int SALT_BYTES = 16;

    private final ConcurrentMap<String, UserAccount> accounts = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final HexFormat hex = HexFormat.of();

    @Override
    public Optional<UserAccount> find(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(key(username)));
    }

    @Override
    public UserAccount create(String username, String password) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        UserAccount account = new UserAccount(username, hex.formatHex(salt) + "$" + hex.formatHex(digest(salt, password)));
        if (accounts.putIfAbsent(key(username), account) != null) {
            throw new IllegalStateException("Account already exists: " + username);
        }
        LOGGER.info("Created account {}", username);
        return account;
    }

    @Override
    public Optional<UserAccount> authenticate(String username, String password) {
        Optional<UserAccount> account = find(username);
        if (account.isEmpty() || password == null) {
            return Optional.empty();
        }
        String stored = account.get().passwordHash();
        int separator = stored.indexOf('$');
        if (separator < 0) {
            LOGGER.warn("Account {} has a malformed password hash", username);
            return Optional.empty();
        }
        byte[] salt = hex.parseHex(stored, 0, separator);
        byte[] expected = hex.parseHex(stored, separator + 1, stored.length());
        if (!MessageDigest.isEqual(expected, digest(salt, password))) {
            LOGGER.debug("Password mismatch for {}", username);
            return Optional.empty();
        }
        return account;
    }

    @Override
    public int size() {
        return accounts.size();
    }

    private static String key(String username) {
        return username.trim().toLowerCase(Locale.ROOT);
    }

    private static byte[] digest(byte[] salt, String password) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(salt);
            return sha.digest(password.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
