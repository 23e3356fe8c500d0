package io.nebula.identity.account;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.user.User;
import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Account emails sent through Quarkus Mailer: email verification and password reset.
 * The sender address comes from quarkus.mailer.from.
 */
@ApplicationScoped
public class AccountMailer {

    private static final Logger LOG = Logger.getLogger(AccountMailer.class);

    static final String VERIFICATION_SUBJECT = "Verify your Nebula email address";
    static final String RESET_SUBJECT = "Reset your Nebula password";

    @Inject
    Mailer mailer;

    /**
     * @throws AuthException MAIL_DELIVERY_FAILED if the mail server refuses the message
     */
    public void sendEmailVerification(User user, String verificationUrl) {
        String body = layout("Verify Your Email Address", String.format("""
            <p>Hi %s,</p>
            <p>Thanks for signing up. Please confirm your email address to activate your account.</p>
            <p><a href="%s" style="background-color: #810FFB; color: white; padding: 12px 24px; border-radius: 6px; text-decoration: none;">Verify Email</a></p>
            <p style="color: #6c757d;">The link expires after a while. If you did not create an account, you can ignore this email.</p>
            """, escapeHtml(greetingName(user)), escapeHtml(verificationUrl)));

        send(user, VERIFICATION_SUBJECT, body);
    }

    /**
     * @throws AuthException MAIL_DELIVERY_FAILED if the mail server refuses the message
     */
    public void sendPasswordReset(User user, String resetUrl) {
        String body = layout("Reset Your Password", String.format("""
            <p>Hi %s,</p>
            <p>We received a request to reset your password. Choose a new one with the link below.</p>
            <p><a href="%s" style="background-color: #810FFB; color: white; padding: 12px 24px; border-radius: 6px; text-decoration: none;">Reset Password</a></p>
            <p style="color: #6c757d;">The link works once and expires soon. If you did not ask for a reset, you can ignore this email.</p>
            """, escapeHtml(greetingName(user)), escapeHtml(resetUrl)));

        send(user, RESET_SUBJECT, body);
    }

    private void send(User user, String subject, String htmlBody) {
        try {
            mailer.send(Mail.withHtml(user.email, subject, htmlBody));
            LOG.infof("Sent '%s' to user %s", subject, user.id);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to send '%s' to user %s", subject, user.id);
            throw new AuthException(AuthFailure.MAIL_DELIVERY_FAILED, "mail to user " + user.id, e);
        }
    }

    private static String layout(String heading, String content) {
        return String.format("""
            <html>
            <body style="font-family: Arial, sans-serif; margin: 0; padding: 0;">
                <div style="background-color: #810FFB; color: white; padding: 20px; border-radius: 5px;">
                    <h2 style="margin: 0;">Nebula</h2>
                </div>
                <div style="padding: 20px; background-color: #f8f9fa; margin-top: 10px; border-radius: 5px;">
                    <h3 style="margin-top: 0;">%s</h3>
                    %s
                </div>
            </body>
            </html>
            """, heading, content);
    }

    private static String greetingName(User user) {
        return user.displayName != null && !user.displayName.isBlank() ? user.displayName : user.username;
    }

    /**
     * Basic HTML escaping
     */
    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
