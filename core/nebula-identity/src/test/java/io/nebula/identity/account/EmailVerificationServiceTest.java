package io.nebula.identity.account;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.testing.InMemoryAccountTokenRepository;
import io.nebula.identity.testing.InMemoryUserRepository;
import io.nebula.identity.user.AuthProvider;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EmailVerificationService.
 * Tokens go through the real AccountTokenService; the mailer is mocked.
 */
class EmailVerificationServiceTest {

    private static final String BASE_URL = "https://id.nebula.test";

    private InMemoryUserRepository userRepository;
    private AccountMailer accountMailer;
    private EmailVerificationService service;

    @BeforeEach
    void setUp() {
        userRepository = new InMemoryUserRepository();
        accountMailer = mock(AccountMailer.class);

        AccountTokenService tokenService = new AccountTokenService();
        tokenService.tokenRepository = new InMemoryAccountTokenRepository();

        AuthConfig authConfig = mock(AuthConfig.class, RETURNS_DEEP_STUBS);
        when(authConfig.account().verificationTtl()).thenReturn(Duration.ofHours(24));

        service = new EmailVerificationService();
        service.userRepository = userRepository;
        service.tokenService = tokenService;
        service.accountMailer = accountMailer;
        service.authConfig = authConfig;

        userRepository.persist(user("usr_new", "new@acme.com", false));
        userRepository.persist(user("usr_done", "done@acme.com", true));
    }

    // ========================================
    // SEND / RESEND
    // ========================================

    @Test
    @DisplayName("sendVerification should mail a link to the verify page")
    void sendVerification_shouldMailLink_whenCalled() {
        // Act
        service.sendVerification(userRepository.findByEmail("new@acme.com").orElseThrow(), BASE_URL);

        // Assert
        String link = sentLink();
        assertThat(link).startsWith(BASE_URL + "/verify-email?token=");
    }

    @Test
    @DisplayName("resendVerification should send nothing for an unknown or verified address")
    void resendVerification_shouldStaySilent_whenNothingToVerify() {
        // Act
        service.resendVerification("nobody@acme.com", BASE_URL);
        service.resendVerification("done@acme.com", BASE_URL);
        service.resendVerification(null, BASE_URL);

        // Assert
        verifyNoInteractions(accountMailer);
    }

    @Test
    @DisplayName("resendVerification should replace the earlier link")
    void resendVerification_shouldSupersedeEarlierLink_whenResent() {
        // Arrange
        service.sendVerification(userRepository.findByEmail("new@acme.com").orElseThrow(), BASE_URL);
        String firstToken = tokenOf(sentLink());
        clearInvocations(accountMailer);

        // Act
        service.resendVerification(" New@Acme.com ", BASE_URL);

        // Assert
        String secondToken = tokenOf(sentLink());
        assertThatThrownBy(() -> service.verifyEmail(firstToken)).isInstanceOf(AuthException.class);
        assertThat(service.verifyEmail(secondToken).emailVerified).isTrue();
    }

    @Test
    @DisplayName("resendVerification should surface a mail failure")
    void resendVerification_shouldFail_whenMailCannotBeSent() {
        // Arrange
        doThrow(new AuthException(AuthFailure.MAIL_DELIVERY_FAILED))
            .when(accountMailer).sendEmailVerification(any(User.class), anyString());

        // Act + Assert
        assertThatThrownBy(() -> service.resendVerification("new@acme.com", BASE_URL))
            .isInstanceOf(AuthException.class)
            .hasMessage(AuthFailure.MAIL_DELIVERY_FAILED.message());
    }

    // ========================================
    // VERIFY
    // ========================================

    @Test
    @DisplayName("verifyEmail should mark the account verified and burn the token")
    void verifyEmail_shouldMarkVerified_whenTokenValid() {
        // Arrange
        service.sendVerification(userRepository.findByEmail("new@acme.com").orElseThrow(), BASE_URL);
        String token = tokenOf(sentLink());

        // Act
        User verified = service.verifyEmail(token);

        // Assert
        assertThat(verified.id).isEqualTo("usr_new");
        assertThat(userRepository.findByEmail("new@acme.com").orElseThrow().emailVerified).isTrue();

        AuthException reuse = catchThrowableOfType(() -> service.verifyEmail(token), AuthException.class);
        assertThat(reuse.failure()).isEqualTo(AuthFailure.INVALID_ACCOUNT_TOKEN);
    }

    @Test
    @DisplayName("verifyEmail should reject an unknown token")
    void verifyEmail_shouldFail_whenTokenUnknown() {
        AuthException thrown = catchThrowableOfType(() -> service.verifyEmail("made-up"), AuthException.class);

        assertThat(thrown.failure()).isEqualTo(AuthFailure.INVALID_ACCOUNT_TOKEN);
        assertThat(userRepository.findByEmail("new@acme.com").orElseThrow().emailVerified).isFalse();
    }

    private String sentLink() {
        ArgumentCaptor<String> link = ArgumentCaptor.forClass(String.class);
        verify(accountMailer).sendEmailVerification(any(User.class), link.capture());
        return link.getValue();
    }

    private static String tokenOf(String link) {
        return link.substring(link.indexOf("token=") + "token=".length());
    }

    private static User user(String id, String email, boolean emailVerified) {
        User user = new User();
        user.id = id;
        user.email = email;
        user.username = id;
        user.role = UserRole.USER;
        user.authProvider = AuthProvider.LOCAL;
        user.emailVerified = emailVerified;
        return user;
    }
}
