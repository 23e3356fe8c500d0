package io.nebula.identity.authentication;

import io.nebula.identity.shared.SecureTokens;
import io.nebula.identity.user.PasswordService;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import io.nebula.identity.user.UserRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Email and password authentication.
 *
 * <p>Unknown email, federated-only account and wrong password all fail with the
 * same {@link AuthFailure#INVALID_CREDENTIALS}, and all three run one Argon2
 * verification so response time does not reveal which case applied.
 *
 * <p>With {@code nebula.auth.account.require-verified-email} on, a correct password
 * for an unverified account with the lowest role fails with
 * {@link AuthFailure#EMAIL_NOT_VERIFIED}. Higher roles are assigned by an administrator
 * and are not held back.
 */
@ApplicationScoped
public class LocalAuthenticator {

    private static final Logger LOG = Logger.getLogger(LocalAuthenticator.class);
    private static final String DUMMY_PASSWORD = "nebula-dummy-password-for-timing";

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    AuthConfig authConfig;

    private volatile String dummyHash;

    /**
     * Verify credentials and record the login.
     *
     * @return the authenticated user
     * @throws AuthException INVALID_CREDENTIALS on any mismatch,
     *                       EMAIL_NOT_VERIFIED when the account still needs email verification
     */
    @Transactional
    public User authenticate(String email, String password) {
        String normalizedEmail = User.normalizeEmail(email);
        Optional<User> found = normalizedEmail == null
            ? Optional.empty()
            : userRepository.findByEmail(normalizedEmail);

        if (found.isEmpty() || !found.get().hasPassword()) {
            passwordService.verifyPassword(password, dummyHash());
            LOG.infof("Login failed for %s: %s", SecureTokens.prefix(normalizedEmail),
                found.isEmpty() ? "no such user" : "no local password");
            throw new AuthException(AuthFailure.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!passwordService.verifyPassword(password, user.passwordHash)) {
            LOG.infof("Login failed for user %s: wrong password", user.id);
            throw new AuthException(AuthFailure.INVALID_CREDENTIALS);
        }

        if (authConfig.account().requireVerifiedEmail() && user.role == UserRole.USER && !user.emailVerified) {
            LOG.infof("Login refused for user %s: email not verified", user.id);
            throw new AuthException(AuthFailure.EMAIL_NOT_VERIFIED);
        }

        if (passwordService.needsRehash(user.passwordHash)) {
            user.passwordHash = passwordService.hashPassword(password);
            LOG.debugf("Rehashed password of user %s with current parameters", user.id);
        }

        Instant now = Instant.now();
        user.lastLoginAt = now;
        user.updatedAt = now;
        userRepository.update(user);

        LOG.infof("Login successful for user %s", user.id);
        return user;
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            synchronized (this) {
                hash = dummyHash;
                if (hash == null) {
                    hash = passwordService.hashPassword(DUMMY_PASSWORD);
                    dummyHash = hash;
                }
            }
        }
        return hash;
    }
}
