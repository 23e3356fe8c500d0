package io.nebula.identity.account;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Email address verification for local accounts.
 *
 * <p>Resending never reveals whether an address is registered or already verified:
 * those cases return quietly without sending anything.
 */
@ApplicationScoped
public class EmailVerificationService {

    private static final Logger LOG = Logger.getLogger(EmailVerificationService.class);

    static final String VERIFY_PAGE = "/verify-email";

    @Inject
    UserRepository userRepository;

    @Inject
    AccountTokenService tokenService;

    @Inject
    AccountMailer accountMailer;

    @Inject
    AuthConfig authConfig;

    /**
     * Issue a verification token and mail the link.
     *
     * @param baseUrl public base URL the link points at
     * @throws io.nebula.identity.authentication.AuthException MAIL_DELIVERY_FAILED if the mail cannot be sent
     */
    public void sendVerification(User user, String baseUrl) {
        String token = tokenService.issue(user.id, AccountTokenPurpose.EMAIL_VERIFICATION,
            authConfig.account().verificationTtl());
        accountMailer.sendEmailVerification(user, baseUrl + VERIFY_PAGE + "?token=" + token);
    }

    /**
     * Send a fresh verification link to an unverified account.
     */
    public void resendVerification(String email, String baseUrl) {
        String normalizedEmail = User.normalizeEmail(email);
        Optional<User> user = normalizedEmail == null ? Optional.empty() : userRepository.findByEmail(normalizedEmail);
        if (user.isEmpty()) {
            LOG.debugf("Verification resend for unknown address ignored");
            return;
        }
        if (user.get().emailVerified) {
            LOG.debugf("Verification resend for verified user %s ignored", user.get().id);
            return;
        }
        sendVerification(user.get(), baseUrl);
    }

    /**
     * Redeem a verification token and mark the account verified.
     *
     * @throws io.nebula.identity.authentication.AuthException INVALID_ACCOUNT_TOKEN if the token cannot be redeemed
     */
    @Transactional
    public User verifyEmail(String token) {
        AccountToken redeemed = tokenService.consume(token, AccountTokenPurpose.EMAIL_VERIFICATION);
        User user = userRepository.findByIdOptional(redeemed.userId)
            .orElseThrow(() -> new IllegalStateException("Token " + redeemed.id + " refers to missing user"));

        user.emailVerified = true;
        user.updatedAt = Instant.now();
        userRepository.update(user);

        LOG.infof("Email verified for user %s", user.id);
        return user;
    }
}
