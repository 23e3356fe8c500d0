package io.nebula.identity.user;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.testing.InMemoryUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Registration against a real PasswordService and an in-memory store.
 */
class UserRegistrationTest {

    private InMemoryUserRepository userRepository;
    private PasswordService passwordService;
    private UserService service;

    @BeforeEach
    void setUp() {
        userRepository = new InMemoryUserRepository();
        passwordService = new PasswordService();
        service = new UserService();
        service.userRepository = userRepository;
        service.passwordService = passwordService;
    }

    @Test
    @DisplayName("second registration with the same email should fail and leave one account")
    void register_shouldRejectSecondAccount_whenSameEmailRegisteredTwice() {
        // Arrange
        User first = service.register("a@x.com", "longenough1", null, null);

        // Act & Assert
        assertThatThrownBy(() -> service.register("A@X.com", "longenough1", null, null))
            .isInstanceOf(AuthException.class)
            .extracting(e -> ((AuthException) e).failure())
            .isEqualTo(AuthFailure.DUPLICATE_ACCOUNT);

        assertThat(userRepository.size()).isEqualTo(1);
        assertThat(passwordService.verifyPassword("longenough1", first.passwordHash)).isTrue();
        assertThat(passwordService.verifyPassword("wrong", first.passwordHash)).isFalse();
    }

    @Test
    @DisplayName("stored hash should never be the plain password")
    void register_shouldStoreArgon2Hash_whenPasswordAccepted() {
        User user = service.register("b@x.com", "longenough1", "bobby", null);

        assertThat(user.passwordHash).isNotEqualTo("longenough1").startsWith("$argon2id$");
        assertThat(UserView.from(user).toString()).doesNotContain(user.passwordHash);
    }
}
