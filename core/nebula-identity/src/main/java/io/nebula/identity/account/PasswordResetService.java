package io.nebula.identity.account;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.session.SessionAuthority;
import io.nebula.identity.user.PasswordService;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Password reset by emailed single-use link.
 *
 * <p>Requests for unknown addresses succeed silently. A completed reset signs
 * the user out everywhere.
 */
@ApplicationScoped
public class PasswordResetService {

    private static final Logger LOG = Logger.getLogger(PasswordResetService.class);

    static final String RESET_PAGE = "/reset-password";

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    AccountTokenService tokenService;

    @Inject
    AccountMailer accountMailer;

    @Inject
    SessionAuthority sessionAuthority;

    @Inject
    AuthConfig authConfig;

    /**
     * Mail a reset link if the address belongs to an account.
     *
     * @throws io.nebula.identity.authentication.AuthException MAIL_DELIVERY_FAILED if the mail cannot be sent
     */
    public void requestReset(String email, String baseUrl) {
        String normalizedEmail = User.normalizeEmail(email);
        Optional<User> user = normalizedEmail == null ? Optional.empty() : userRepository.findByEmail(normalizedEmail);
        if (user.isEmpty()) {
            LOG.debugf("Password reset for unknown address ignored");
            return;
        }

        String token = tokenService.issue(user.get().id, AccountTokenPurpose.PASSWORD_RESET,
            authConfig.account().resetTtl());
        accountMailer.sendPasswordReset(user.get(), baseUrl + RESET_PAGE + "?token=" + token);
    }

    /**
     * Whether a reset link can still be used. Does not redeem it.
     */
    public boolean isResetTokenValid(String token) {
        return tokenService.inspect(token, AccountTokenPurpose.PASSWORD_RESET).isPresent();
    }

    /**
     * Redeem a reset token and set a new password.
     * The password policy is checked before the token is touched.
     *
     * @throws IllegalArgumentException if the new password violates the policy
     * @throws io.nebula.identity.authentication.AuthException INVALID_ACCOUNT_TOKEN if the token cannot be redeemed
     */
    @Transactional
    public User resetPassword(String token, String newPassword) {
        String passwordHash = passwordService.validateAndHashPassword(newPassword);

        AccountToken redeemed = tokenService.consume(token, AccountTokenPurpose.PASSWORD_RESET);
        User user = userRepository.findByIdOptional(redeemed.userId)
            .orElseThrow(() -> new IllegalStateException("Token " + redeemed.id + " refers to missing user"));

        user.passwordHash = passwordHash;
        user.updatedAt = Instant.now();
        userRepository.update(user);

        long revoked = sessionAuthority.revokeAll(user.id);
        LOG.infof("Password reset for user %s, %d sessions revoked", user.id, revoked);
        return user;
    }
}
