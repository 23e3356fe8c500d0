package io.nebula.identity.user;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.shared.EntityType;
import io.nebula.identity.shared.TsidGenerator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Locale;

/**
 * User lifecycle operations outside the login paths: local registration,
 * username allocation and administrative role changes.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    static final int MIN_USERNAME_LENGTH = 3;
    static final int MAX_USERNAME_BASE_LENGTH = 30;

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    /**
     * Register a local (password-based) user.
     *
     * <p>The role is always the lowest tier and the account has no organization
     * until an administrator assigns one. The email is not verified.
     *
     * @param email       Email address, normalized before use
     * @param password    Plain text password (validated and hashed)
     * @param username    Requested username, or null to derive one from the email
     * @param displayName Display name, or null to use the username
     * @return the created user
     * @throws IllegalArgumentException if email, username or password is invalid
     * @throws AuthException with DUPLICATE_ACCOUNT if the email or username is taken
     */
    @Transactional
    public User register(String email, String password, String username, String displayName) {
        String normalizedEmail = User.normalizeEmail(email);
        if (normalizedEmail == null) {
            throw new IllegalArgumentException("Email cannot be null or empty");
        }
        String domain = User.emailDomain(normalizedEmail);

        if (userRepository.findByEmail(normalizedEmail).isPresent()) {
            LOG.infof("Registration rejected: email already registered (domain %s)", domain);
            throw new AuthException(AuthFailure.DUPLICATE_ACCOUNT);
        }

        String effectiveUsername;
        if (username != null && !username.isBlank()) {
            effectiveUsername = username.trim();
            if (effectiveUsername.length() < MIN_USERNAME_LENGTH) {
                throw new IllegalArgumentException(
                    "Username must be at least " + MIN_USERNAME_LENGTH + " characters long");
            }
            if (userRepository.findByUsername(effectiveUsername).isPresent()) {
                throw new AuthException(AuthFailure.DUPLICATE_ACCOUNT, "username taken");
            }
        } else {
            effectiveUsername = generateUniqueUsername(normalizedEmail);
        }

        String passwordHash = passwordService.validateAndHashPassword(password);

        User user = new User();
        user.id = TsidGenerator.generate(EntityType.USER);
        user.email = normalizedEmail;
        user.username = effectiveUsername;
        user.passwordHash = passwordHash;
        user.displayName = displayName != null && !displayName.isBlank() ? displayName.trim() : effectiveUsername;
        user.role = UserRole.lowest();
        user.organizationId = null;
        user.authProvider = AuthProvider.LOCAL;
        user.emailVerified = false;

        userRepository.persist(user);
        LOG.infof("Registered local user %s", user.id);
        return user;
    }

    /**
     * Derive a username from the local part of an email address.
     * Non-alphanumeric characters are dropped and a numeric suffix is appended
     * until the name is free.
     */
    public String generateUniqueUsername(String email) {
        String base = User.emailLocalPart(email).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (base.length() > MAX_USERNAME_BASE_LENGTH) {
            base = base.substring(0, MAX_USERNAME_BASE_LENGTH);
        }
        if (base.length() < MIN_USERNAME_LENGTH) {
            base = "user" + base;
        }

        String candidate = base;
        int suffix = 1;
        while (userRepository.findByUsername(candidate).isPresent()) {
            candidate = base + suffix++;
        }
        return candidate;
    }

    /**
     * Change a user's role. Takes effect on the user's next request,
     * since sessions re-read the user every time.
     *
     * @throws NotFoundException if the user does not exist
     */
    @Transactional
    public User changeRole(String userId, UserRole newRole) {
        User user = userRepository.findByIdOptional(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));

        UserRole previous = user.role;
        user.role = newRole;
        user.updatedAt = Instant.now();
        userRepository.update(user);

        LOG.infof("Role of user %s changed from %s to %s", userId, previous.code(), newRole.code());
        return user;
    }
}
